package com.websweep.core.util;

@FunctionalInterface
public interface ProgressListener {
    /**
     * @param percent 0~100
     * @param phase   "access" | "crawl" | "finalize" | "done"
     * @param done    처리한 페이지 수(모르면 -1)
     * @param total   페이지 상한(모르면 -1)
     */
    void onProgress(int percent, String phase, long done, long total);

    ProgressListener NONE = (p, phase, d, t) -> {};
}
