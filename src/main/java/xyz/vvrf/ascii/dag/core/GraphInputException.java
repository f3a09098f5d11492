package xyz.vvrf.ascii.dag.core;

/**
 * 输入图不合法时抛出：重复节点、边引用了不存在的端点，或输入格式 (如 DOT) 语法错误。
 *
 * @author ruifeng.wen
 */
public class GraphInputException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public GraphInputException(String message) {
        super(message);
    }

    public GraphInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
