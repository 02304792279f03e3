package ai.customfit.sdk;

import java.util.List;

/**
 * Notified when analytics items are discarded without being delivered, because a queue
 * overflowed or because items from a failed delivery could not be put back.
 *
 * @param <T> the item type
 * @see CFClient#addEventDropListener(QueueItemDroppedListener)
 */
public interface QueueItemDroppedListener<T> {
    /**
     * Called on the SDK's callback thread.
     *
     * @param queueName the queue that dropped the items
     * @param items the dropped items, oldest first
     */
    void onItemsDropped(String queueName, List<T> items);
}
