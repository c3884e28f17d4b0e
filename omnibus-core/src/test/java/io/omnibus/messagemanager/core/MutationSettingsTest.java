package io.omnibus.messagemanager.core;

import java.util.Properties;

import org.junit.Assert;
import org.junit.Test;

public class MutationSettingsTest {

    @Test
    public void fromProperties_usesDefaultsForAbsentKeys() {
        Properties properties = new Properties();
        properties.setProperty(MutationSettings.PROP_CHUNK_SIZE, " 250 ");
        properties.setProperty(MutationSettings.PROP_DUPLICATE_ID_POLICY, "abort");

        MutationSettings settings = MutationSettings.fromProperties(properties);

        Assert.assertEquals(250, settings.getChunkSize());
        Assert.assertEquals(DuplicateIdPolicy.ABORT, settings.getDuplicateIdPolicy());
        Assert.assertEquals(Statics.DEFAULT_DRAIN_BATCH_SIZE, settings.getDrainBatchSize());
        Assert.assertEquals(Statics.DEFAULT_CHUNK_RETRIES, settings.getChunkRetries());
        Assert.assertEquals(Statics.DEFAULT_CONNECT_TIMEOUT_MILLIS, settings.getConnectTimeoutMillis());
    }

    @Test(expected = IllegalArgumentException.class)
    public void fromProperties_rejectsNonNumbers() {
        Properties properties = new Properties();
        properties.setProperty(MutationSettings.PROP_DRAIN_BATCH_SIZE, "lots");

        MutationSettings.fromProperties(properties);
    }

    @Test(expected = IllegalArgumentException.class)
    public void builder_rejectsZeroBatchSize() {
        MutationSettings.builder().drainBatchSize(0);
    }

    @Test
    public void builder_allowsZeroRetries() {
        MutationSettings settings = MutationSettings.builder().chunkRetries(0).receiptRetries(0).build();

        Assert.assertEquals(0, settings.getChunkRetries());
        Assert.assertEquals(0, settings.getReceiptRetries());
    }
}
