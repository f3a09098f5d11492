package xyz.vvrf.ascii.dag.config;

import lombok.Builder;
import lombok.Value;
import xyz.vvrf.ascii.dag.core.CharSet;
import xyz.vvrf.ascii.dag.core.NodeStyle;
import xyz.vvrf.ascii.dag.core.RenderOptions;

/**
 * 调用方对渲染配置的局部覆盖。所有字段都可以为 null，表示沿用基础配置。
 * <p>
 * 用于宿主层 (CLI、Spring 配置) 的两来源合并：宿主提供默认值，调用方只覆盖自己关心的字段。
 * 合并在调用渲染器之前完成，渲染器本身只接收一个完整的 {@link RenderOptions}。
 *
 * @author ruifeng.wen
 */
@Value
@Builder
public class RenderOptionOverrides {

    NodeStyle nodeStyle;
    RenderOptions.Delimiters customDelimiters;
    CharSet charset;
    Integer nodeSpacing;
    Integer layerSpacing;
    Boolean showArrows;
    Integer maxCrossingSweeps;

    public static RenderOptionOverrides none() {
        return RenderOptionOverrides.builder().build();
    }

    /**
     * 把非 null 的字段覆盖到基础配置上。结果不做校验，由渲染器统一校验。
     *
     * @param base 基础配置
     * @return 合并后的新配置
     */
    public RenderOptions applyTo(RenderOptions base) {
        RenderOptions.RenderOptionsBuilder builder = base.toBuilder();
        if (nodeStyle != null) {
            builder.nodeStyle(nodeStyle);
        }
        if (customDelimiters != null) {
            builder.customDelimiters(customDelimiters);
        }
        if (charset != null) {
            builder.charset(charset);
        }
        if (nodeSpacing != null) {
            builder.nodeSpacing(nodeSpacing);
        }
        if (layerSpacing != null) {
            builder.layerSpacing(layerSpacing);
        }
        if (showArrows != null) {
            builder.showArrows(showArrows);
        }
        if (maxCrossingSweeps != null) {
            builder.maxCrossingSweeps(maxCrossingSweeps);
        }
        return builder.build();
    }

    /**
     * 合并两组覆盖，other 中非 null 的字段优先。
     */
    public RenderOptionOverrides overriddenBy(RenderOptionOverrides other) {
        return RenderOptionOverrides.builder()
                .nodeStyle(other.nodeStyle != null ? other.nodeStyle : nodeStyle)
                .customDelimiters(other.customDelimiters != null ? other.customDelimiters : customDelimiters)
                .charset(other.charset != null ? other.charset : charset)
                .nodeSpacing(other.nodeSpacing != null ? other.nodeSpacing : nodeSpacing)
                .layerSpacing(other.layerSpacing != null ? other.layerSpacing : layerSpacing)
                .showArrows(other.showArrows != null ? other.showArrows : showArrows)
                .maxCrossingSweeps(other.maxCrossingSweeps != null ? other.maxCrossingSweeps : maxCrossingSweeps)
                .build();
    }

    public boolean isEmpty() {
        return nodeStyle == null && customDelimiters == null && charset == null && nodeSpacing == null
                && layerSpacing == null && showArrows == null && maxCrossingSweeps == null;
    }
}
