package io.omnibus.messagemanager.api;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Assert;
import org.junit.Test;

import io.omnibus.messagemanager.api.BulkResult.Failure;
import io.omnibus.messagemanager.api.BulkResult.FailureReason;

public class BulkResultTest {

    @Test
    public void completeSuccessDoesNotThrow() {
        BulkResult result = new BulkResult(3, 0, Collections.emptyList());

        Assert.assertSame(result, result.throwIfAnyFailed());
        Assert.assertTrue(result.isCompleteSuccess());
    }

    @Test
    public void partialFailureCarriesResult() {
        Failure failure = new Failure(1, Arrays.asList("x", "y"), FailureReason.RETRIES_EXHAUSTED, "broker down");
        BulkResult result = new BulkResult(5, 2, Collections.singletonList(failure));

        try {
            result.throwIfAnyFailed();
            Assert.fail("Should have thrown");
        }
        catch (PartialFailureException e) {
            Assert.assertSame(result, e.getResult());
            Assert.assertEquals(Arrays.asList("x", "y"), e.getResult().getFailures().get(0).getIds());
        }
    }

    @Test
    public void negativeDepthIsClampedToZero() {
        Assert.assertEquals(0, new BrokerQueue("q", "q", -4).getApproximateDepth());
    }
}
