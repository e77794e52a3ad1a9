package io.writebuffer.runtime;

@FunctionalInterface
public interface FlushProgressListener {
    void onProgress(int committed, int remaining, int failed);
}
