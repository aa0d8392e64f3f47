/**
 * EventChannel.java
 *
 * 一个可关闭的无界事件通道，生产者（传输层）和消费者（事件分发循环）共享。
 * 关闭后不再接受新元素；已入队的元素仍会按 FIFO 顺序被取出，
 * 之后 take() 返回 null，消费者据此退出循环。
 */
package club.ppmc.aidbg.util;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public class EventChannel<T> {

    /** 消费者检查关闭标志的间隔。 */
    static final long CLOSE_CHECK_INTERVAL_MS = 50;

    private final LinkedBlockingQueue<T> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * 放入一个元素。
     *
     * @return 如果通道已关闭返回 false，元素被丢弃。
     */
    public boolean offer(T item) {
        if (item == null || closed.get()) {
            return false;
        }
        return queue.offer(item);
    }

    /**
     * 阻塞直到有元素可取或通道关闭。
     *
     * @return 下一个元素；通道已关闭且队列中的剩余元素已取完时返回 null。
     */
    public T take() throws InterruptedException {
        while (true) {
            T next = queue.poll(CLOSE_CHECK_INTERVAL_MS, TimeUnit.MILLISECONDS);
            if (next != null) {
                return next;
            }
            if (closed.get() && queue.isEmpty()) {
                return null;
            }
        }
    }

    /** 关闭通道。重复调用无效果。 */
    public void close() {
        closed.set(true);
    }

    public boolean isClosed() {
        return closed.get();
    }

    /** 当前排队中的元素数量。 */
    public int pending() {
        return queue.size();
    }
}
