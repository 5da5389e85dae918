package work.pollochang.thumbnail.image.channel;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 單一生產者與單一消費者之間的 FIFO 交換佇列。
 * <p>
 * 容量大於 0 時為有界佇列，滿了 {@link #put(WorkItem)} 會阻塞；容量為 0 表示不限制。
 * {@link #complete()} 只能呼叫一次，放入的 {@link ChannelMessage.End} 一定是最後一個被取出的訊息。
 */
public class WorkChannel {

    private final BlockingQueue<ChannelMessage> queue;
    private final int capacity;
    private final AtomicBoolean completed = new AtomicBoolean(false);
    private final AtomicBoolean endDelivered = new AtomicBoolean(false);
    private final AtomicInteger enqueuedItems = new AtomicInteger(0);

    public WorkChannel(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must not be negative: " + capacity);
        }
        this.capacity = capacity;
        this.queue = capacity == 0 ? new LinkedBlockingQueue<>() : new ArrayBlockingQueue<>(capacity);
    }

    public static WorkChannel unbounded() {
        return new WorkChannel(0);
    }

    /**
     * 放入工作項目，佇列已滿時阻塞直到消費者取走資料。
     *
     * @throws IllegalStateException 已送出結束訊號
     * @throws InterruptedException  等待時被中斷 (取消)
     */
    public void put(WorkItem item) throws InterruptedException {
        Objects.requireNonNull(item, "item must not be null");
        if (completed.get()) {
            throw new IllegalStateException("已送出結束訊號，不可再放入工作項目: " + item.name());
        }
        queue.put(new ChannelMessage.Item(item));
        enqueuedItems.incrementAndGet();
    }

    /**
     * 放入結束訊號。
     *
     * @throws IllegalStateException 重複呼叫
     * @throws InterruptedException  等待時被中斷 (取消)
     */
    public void complete() throws InterruptedException {
        if (!completed.compareAndSet(false, true)) {
            throw new IllegalStateException("結束訊號只能送出一次");
        }
        queue.put(ChannelMessage.End.INSTANCE);
    }

    /**
     * 取出下一個訊息，佇列為空時阻塞。
     *
     * @throws IllegalStateException 結束訊號已被取出
     * @throws InterruptedException  等待時被中斷 (取消)
     */
    public ChannelMessage take() throws InterruptedException {
        if (endDelivered.get()) {
            throw new IllegalStateException("結束訊號已被取出，佇列不會再有資料");
        }
        ChannelMessage message = queue.take();
        if (message instanceof ChannelMessage.End) {
            endDelivered.set(true);
        }
        return message;
    }

    public boolean isCompleted() {
        return completed.get();
    }

    public int getCapacity() {
        return capacity;
    }

    public int getEnqueuedItems() {
        return enqueuedItems.get();
    }

    public int size() {
        return queue.size();
    }
}
