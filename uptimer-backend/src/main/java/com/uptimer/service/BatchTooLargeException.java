package com.uptimer.service;

public class BatchTooLargeException extends RuntimeException {

    private final int size;
    private final int max;

    public BatchTooLargeException(int size, int max) {
        super("Too many URLs, maximum allowed is " + max);
        this.size = size;
        this.max = max;
    }

    public int getSize() {
        return size;
    }

    public int getMax() {
        return max;
    }
}
