package com.energy.reconcile.model;

/**
 * 家庭数据表中的一列。
 *
 * 列与表中的时间戳列按行号一一对应。所有实现都支持按行号映射重排（select），
 * 这是补齐采样间隔、时间戳对齐和多序列合并共用的基础操作：
 * 映射中的 -1 表示目标行在源表中不存在，结果为未知值。
 */
public abstract class Column {

    private final String name;

    protected Column(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Column name must not be null or blank");
        }
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public abstract int size();

    /** 指定行是否为已知值 */
    public abstract boolean isKnown(int row);

    /**
     * 按行号映射生成新列。
     *
     * @param rows 新列第 i 行取源列的 rows[i] 行；rows[i] 小于 0 时为未知值
     * @return 新列，名称不变
     */
    public abstract Column select(int[] rows);

    /** 深拷贝 */
    public abstract Column copy();

    /** 返回内容相同、名称不同的新列 */
    public abstract Column rename(String newName);

    public int countKnown() {
        int count = 0;
        for (int i = 0; i < size(); i++) {
            if (isKnown(i)) count++;
        }
        return count;
    }

    protected void checkRow(int row) {
        if (row < 0 || row >= size()) {
            throw new IndexOutOfBoundsException("Row " + row + " out of range for column '"
                    + name + "' of size " + size());
        }
    }
}
