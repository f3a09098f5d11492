package xyz.vvrf.ascii.dag.core;

/**
 * 渲染选项非法时抛出 (未知样式/字符集名称、非正的间距等)。
 * 在任何布局工作开始之前报告，不会产生部分渲染结果。
 *
 * @author ruifeng.wen
 */
public class ConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
