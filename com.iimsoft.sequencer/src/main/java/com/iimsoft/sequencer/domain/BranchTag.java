package com.iimsoft.sequencer.domain;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 分支标记：区分“已提交链”（ROOT）和私有的写时复制分支。
 *
 * 非 ROOT 标记记录创建分支时资源的结构版本号，merge 时用来判断分支是否已过期。
 */
public final class BranchTag {

    public static final BranchTag ROOT = new BranchTag(0L, -1L);

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final long id;
    private final long baseRevision;

    private BranchTag(long id, long baseRevision) {
        this.id = id;
        this.baseRevision = baseRevision;
    }

    public static BranchTag fresh(Resource resource) {
        long revision = resource == null ? -1L : resource.getRevision();
        return new BranchTag(SEQUENCE.incrementAndGet(), revision);
    }

    public boolean isRoot() {
        return this == ROOT;
    }

    public long getBaseRevision() {
        return baseRevision;
    }

    @Override
    public String toString() {
        return isRoot() ? "root" : "branch#" + id;
    }
}
