package xyz.vvrf.ascii.dag.render;

/**
 * 画布上可能出现的语义符号 (节点定界符除外)。
 * 拐角与三通按其连通的方向命名，例如 {@link #CORNER_DOWN_RIGHT} 连接下方和右方 (┌)。
 *
 * @author ruifeng.wen
 */
public enum Glyph {
    VERTICAL,
    HORIZONTAL,
    CORNER_DOWN_RIGHT,
    CORNER_DOWN_LEFT,
    CORNER_UP_RIGHT,
    CORNER_UP_LEFT,
    /** 上下贯通并向右分支 (├) */
    TEE_RIGHT,
    /** 上下贯通并向左分支 (┤) */
    TEE_LEFT,
    /** 左右贯通并向下分支 (┬) */
    TEE_DOWN,
    /** 左右贯通并向上分支 (┴) */
    TEE_UP,
    CROSSING,
    ARROW_UP,
    ARROW_DOWN,
    ARROW_LEFT,
    ARROW_RIGHT,
    SELF_LOOP
}
