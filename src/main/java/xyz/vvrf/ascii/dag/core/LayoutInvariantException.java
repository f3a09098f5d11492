package xyz.vvrf.ascii.dag.core;

/**
 * 内部布局不变量被破坏 (例如分层后仍有节点未分配层)。
 * 对合法输入不应出现，出现即代表程序缺陷，而不是可恢复的情况。
 *
 * @author ruifeng.wen
 */
public class LayoutInvariantException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public LayoutInvariantException(String message) {
        super(message);
    }
}
