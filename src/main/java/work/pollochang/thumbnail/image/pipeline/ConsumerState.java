package work.pollochang.thumbnail.image.pipeline;

public enum ConsumerState {
    RUNNING,
    DONE
}
