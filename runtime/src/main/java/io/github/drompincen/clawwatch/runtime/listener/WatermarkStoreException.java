package io.github.drompincen.clawwatch.runtime.listener;

public class WatermarkStoreException extends RuntimeException {

    public WatermarkStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
