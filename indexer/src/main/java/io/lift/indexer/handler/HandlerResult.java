package io.lift.indexer.handler;

public record HandlerResult(boolean success, String error) {

    private static final HandlerResult OK = new HandlerResult(true, null);

    public static HandlerResult ok() {
        return OK;
    }

    public static HandlerResult failed(String error) {
        return new HandlerResult(false, error == null || error.isBlank() ? "handler failed" : error);
    }
}
