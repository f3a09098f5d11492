package xyz.vvrf.ascii.dag.core;

import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * 一次渲染调用的全部配置（不可变）。
 * 每次 render 调用显式传入，不存在进程级的可变全局配置。
 * <p>
 * 构建器本身不做校验；渲染器在开始任何布局工作之前调用 {@link #validate()}，
 * 非法取值直接抛出 {@link ConfigurationException}，不会被静默修正。
 *
 * @author ruifeng.wen
 */
@Value
@Builder(toBuilder = true)
public class RenderOptions {

    public static final int DEFAULT_NODE_SPACING = 4;
    public static final int DEFAULT_LAYER_SPACING = 2;
    public static final int DEFAULT_MAX_CROSSING_SWEEPS = 24;
    public static final int MAX_CROSSING_SWEEPS_LIMIT = 1000;

    /**
     * 节点样式，默认方括号。
     */
    @Builder.Default
    NodeStyle nodeStyle = NodeStyle.SQUARE;

    /**
     * 仅当 nodeStyle 为 CUSTOM 时使用的定界符对。
     */
    Delimiters customDelimiters;

    @Builder.Default
    CharSet charset = CharSet.UNICODE;

    /**
     * 同一层相邻节点之间的最小水平间距 (列数)。
     */
    @Builder.Default
    int nodeSpacing = DEFAULT_NODE_SPACING;

    /**
     * 相邻两层之间的空行数。
     */
    @Builder.Default
    int layerSpacing = DEFAULT_LAYER_SPACING;

    /**
     * 是否绘制方向箭头 (包括回边标记)。自环标记始终绘制。
     */
    @Builder.Default
    boolean showArrows = true;

    /**
     * 交叉最小化的最大扫描轮数，0 表示保持初始顺序。
     */
    @Builder.Default
    int maxCrossingSweeps = DEFAULT_MAX_CROSSING_SWEEPS;

    public static RenderOptions defaults() {
        return RenderOptions.builder().build();
    }

    /**
     * 校验所有取值。
     *
     * @return this，便于链式调用
     * @throws ConfigurationException 任一取值非法时
     */
    public RenderOptions validate() {
        if (nodeStyle == null) {
            throw new ConfigurationException("nodeStyle must not be null");
        }
        if (charset == null) {
            throw new ConfigurationException("charset must not be null");
        }
        if (nodeSpacing <= 0) {
            throw new ConfigurationException("nodeSpacing must be positive, got " + nodeSpacing);
        }
        if (layerSpacing <= 0) {
            throw new ConfigurationException("layerSpacing must be positive, got " + layerSpacing);
        }
        if (maxCrossingSweeps < 0 || maxCrossingSweeps > MAX_CROSSING_SWEEPS_LIMIT) {
            throw new ConfigurationException(String.format("maxCrossingSweeps must be within [0, %d], got %d",
                    MAX_CROSSING_SWEEPS_LIMIT, maxCrossingSweeps));
        }
        if (nodeStyle == NodeStyle.CUSTOM) {
            if (customDelimiters == null) {
                throw new ConfigurationException("nodeStyle CUSTOM requires customDelimiters");
            }
            checkDelimiter("left", customDelimiters.getLeft());
            checkDelimiter("right", customDelimiters.getRight());
        }
        return this;
    }

    private void checkDelimiter(String side, String delimiter) {
        for (int i = 0; i < delimiter.length(); i++) {
            char c = delimiter.charAt(i);
            if (Character.isISOControl(c)) {
                throw new ConfigurationException(String.format("Custom %s delimiter must not contain control characters: '%s'", side, delimiter));
            }
            if (charset == CharSet.ASCII && (c < 0x20 || c > 0x7E)) {
                throw new ConfigurationException(String.format("Custom %s delimiter '%s' is not printable 7-bit ASCII but charset is ascii", side, delimiter));
            }
        }
    }

    /**
     * 自定义样式的左右定界符。两者都可以为空串，但不能为 null。
     */
    @Value
    public static class Delimiters {
        String left;
        String right;

        public Delimiters(String left, String right) {
            this.left = Objects.requireNonNull(left, "左定界符不能为空");
            this.right = Objects.requireNonNull(right, "右定界符不能为空");
        }

        public static Delimiters of(String left, String right) {
            return new Delimiters(left, right);
        }
    }
}
