package com.diskindex.storage;

/**
 * Delta编码器
 *
 * 倒排列表中的docId严格递增，存储相邻差值后配合VarInt可显著缩小体积。
 *
 * 示例：[10, 15, 20, 25] -> [10, 5, 5, 5]
 */
public final class DeltaCodec {

    private DeltaCodec() {
        // 工具类，禁止实例化
    }

    /**
     * 对严格递增的非负序列进行Delta编码
     *
     * @param sortedValues 严格递增序列
     * @return Delta编码后的数组
     * @throws IllegalArgumentException 输入为null、含负数或非严格递增
     */
    public static int[] encode(int[] sortedValues) {
        if (sortedValues == null) {
            throw new IllegalArgumentException("输入数组不能为null");
        }
        int[] deltas = new int[sortedValues.length];
        for (int i = 0; i < sortedValues.length; i++) {
            if (sortedValues[i] < 0) {
                throw new IllegalArgumentException("输入不能包含负数，位置 " + i + " 的值为 " + sortedValues[i]);
            }
            if (i == 0) {
                deltas[i] = sortedValues[i];
                continue;
            }
            if (sortedValues[i] <= sortedValues[i - 1]) {
                throw new IllegalArgumentException("输入必须严格递增，在位置 " + i + " 处违反");
            }
            deltas[i] = sortedValues[i] - sortedValues[i - 1];
        }
        return deltas;
    }

    /**
     * 从Delta编码还原原始序列
     *
     * @param deltas Delta编码后的数组
     * @return 还原后的原始序列
     */
    public static int[] decode(int[] deltas) {
        if (deltas == null) {
            throw new IllegalArgumentException("输入数组不能为null");
        }
        int[] values = new int[deltas.length];
        for (int i = 0; i < deltas.length; i++) {
            values[i] = i == 0 ? deltas[i] : values[i - 1] + deltas[i];
        }
        return values;
    }
}
