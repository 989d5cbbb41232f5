package com.lakeindex.benchmark;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * 单调前进的删除游标：顺序或固定种子随机排列地遍历初始存活文档。
 */
public final class DeletionCursor {
    private final List<Integer> order;
    private int position;

    public DeletionCursor(List<Integer> docIds, boolean randomOrder, long seed) {
        List<Integer> ordered = new ArrayList<>(docIds);
        if (randomOrder) {
            Collections.shuffle(ordered, new Random(seed));
        } else {
            Collections.sort(ordered);
        }
        this.order = List.copyOf(ordered);
    }

    /**
     * 取出下一批文档ID，剩余不足时返回剩余全部。
     */
    public List<Integer> next(int batchSize) {
        int end = Math.min(order.size(), position + Math.max(batchSize, 0));
        List<Integer> batch = order.subList(position, end);
        position = end;
        return batch;
    }

    public int consumed() {
        return position;
    }

    public boolean isExhausted() {
        return position >= order.size();
    }
}
