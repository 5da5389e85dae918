package work.pollochang.thumbnail.image.channel;

/**
 * 佇列中的訊息: 工作項目或結束訊號。
 */
public sealed interface ChannelMessage {

    record Item(WorkItem workItem) implements ChannelMessage {
    }

    /**
     * 結束訊號，生產者在最後一個工作項目之後送出一次。
     */
    record End() implements ChannelMessage {
        public static final End INSTANCE = new End();
    }
}
