package xyz.vvrf.ascii.dag.core;

import java.util.Locale;

/**
 * 输出字符集。
 *
 * @author ruifeng.wen
 */
public enum CharSet {
    /** 仅 7 位可打印 ASCII 字符 */
    ASCII,
    /** Unicode 制表符与箭头 */
    UNICODE;

    /**
     * 按名称 (不区分大小写) 解析字符集。
     *
     * @throws ConfigurationException 如果名称未知
     */
    public static CharSet fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            for (CharSet charSet : values()) {
                if (charSet.name().equals(normalized)) {
                    return charSet;
                }
            }
        }
        throw new ConfigurationException(String.format("Unknown charset '%s'. Expected one of: ascii, unicode", name));
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
