package ai.customfit.sdk;

/**
 * An analytics record that can be buffered in a {@link DeliveryQueue}.
 */
interface QueueItem {
    /**
     * @return when the item was generated, in the format the analytics endpoints expect
     */
    String getTimestamp();
}
