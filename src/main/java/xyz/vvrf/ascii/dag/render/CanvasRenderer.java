package xyz.vvrf.ascii.dag.render;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.ascii.dag.core.GraphEdge;
import xyz.vvrf.ascii.dag.core.LayoutInvariantException;
import xyz.vvrf.ascii.dag.layout.GraphLayout;
import xyz.vvrf.ascii.dag.layout.LayeredGraph;
import xyz.vvrf.ascii.dag.layout.LayoutVertex;

import java.util.*;
import java.util.function.IntPredicate;

/**
 * 把 {@link GraphLayout} 绘制到 {@link Canvas} 上。
 * <p>
 * 绘制顺序：节点字形、连线路径、方向标记、自环标记。
 * 相邻两层之间的水平走线按上端点分组 (bundle)，每组占用层间的一行；
 * 组之间按区间贪心分配到最靠上且互不重叠 (至少留一格间隙) 的行。
 * 层间行数由 {@link xyz.vvrf.ascii.dag.layout.CoordinateAssigner} 预留，总能放下所有组。
 * 方向标记避开交叉单元格，只有整段都是交叉时才覆盖在交叉上。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class CanvasRenderer {

    private final GlyphSet glyphs;
    private final boolean showArrows;

    public CanvasRenderer(GlyphSet glyphs, boolean showArrows) {
        this.glyphs = Objects.requireNonNull(glyphs, "字形表不能为空");
        this.showArrows = showArrows;
    }

    /**
     * 绘制整个布局。
     *
     * @param layout 最终布局
     * @return 绘制完成的画布
     */
    public Canvas render(GraphLayout layout) {
        Canvas canvas = new Canvas(layout.getCanvasWidth(), layout.getCanvasHeight());
        paintNodes(canvas, layout);

        List<EdgeRoute> routes = buildRoutes(layout);
        assignBendRows(routes, layout);
        for (EdgeRoute route : routes) {
            paintRoute(canvas, route, layout);
        }
        if (showArrows) {
            for (EdgeRoute route : routes) {
                paintMarkers(canvas, route, layout);
            }
        }
        paintSelfLoops(canvas, layout);

        log.debug("Canvas painted: {}x{}, {} route(s), {} self-loop(s)", canvas.getWidth(), canvas.getHeight(),
                routes.size(), layout.getLayeredGraph().getSelfLoops().size());
        return canvas;
    }

    private void paintNodes(Canvas canvas, GraphLayout layout) {
        for (List<LayoutVertex> layer : layout.getLayers()) {
            for (LayoutVertex vertex : layer) {
                if (!vertex.isVirtual()) {
                    canvas.putNode(layout.getRow(vertex), layout.getX(vertex), glyphs.nodeGlyph(vertex.getNode().getLabel()));
                }
            }
        }
    }

    private List<EdgeRoute> buildRoutes(GraphLayout layout) {
        Map<String, EdgeRoute> routes = new LinkedHashMap<>();
        for (LayeredGraph.EdgeChain chain : layout.getLayeredGraph().getChains()) {
            EdgeRoute route = EdgeRoute.of(chain, layout);
            EdgeRoute existing = routes.get(route.routeKey());
            if (existing != null) {
                existing.merge(route);
            } else {
                routes.put(route.routeKey(), route);
            }
        }
        return new ArrayList<>(routes.values());
    }

    /**
     * 为每个需要拐弯的线段选定层间的水平走线行。
     */
    private void assignBendRows(List<EdgeRoute> routes, GraphLayout layout) {
        int layerCount = layout.getLayers().size();
        for (int layer = 0; layer + 1 < layerCount; layer++) {
            int firstGapRow = layout.getLayerRow(layer) + 1;
            int gapRows = layout.getLayerRow(layer + 1) - firstGapRow;

            Map<String, Bundle> bundles = new LinkedHashMap<>();
            for (EdgeRoute route : routes) {
                for (int s = 0; s < route.getSegmentCount(); s++) {
                    if (route.getUpper(s).getLayer() != layer || !route.bends(s)) {
                        continue;
                    }
                    String key = route.getUpper(s) + ":" + route.getUpperColumn(s);
                    bundles.computeIfAbsent(key, k -> new Bundle()).add(route, s);
                }
            }
            if (bundles.isEmpty()) {
                continue;
            }

            List<Bundle> ordered = new ArrayList<>(bundles.values());
            ordered.sort(Comparator.comparingInt((Bundle b) -> b.start).thenComparingInt(b -> b.end));
            List<List<Bundle>> rows = new ArrayList<>();
            for (int i = 0; i < gapRows; i++) {
                rows.add(new ArrayList<>());
            }
            for (Bundle bundle : ordered) {
                int chosen = -1;
                for (int r = 0; r < gapRows && chosen < 0; r++) {
                    if (fits(bundle, rows.get(r))) {
                        chosen = r;
                    }
                }
                if (chosen < 0) {
                    throw new LayoutInvariantException(String.format("No free gap row below layer %d for bundle [%d, %d] (%d row(s))",
                            layer, bundle.start, bundle.end, gapRows));
                }
                rows.get(chosen).add(bundle);
                bundle.applyRow(firstGapRow + chosen);
            }
        }
    }

    private static boolean fits(Bundle bundle, List<Bundle> placed) {
        for (Bundle other : placed) {
            if (!(bundle.end + 1 < other.start || other.end + 1 < bundle.start)) {
                return false;
            }
        }
        return true;
    }

    private void paintRoute(Canvas canvas, EdgeRoute route, GraphLayout layout) {
        for (int s = 0; s < route.getSegmentCount(); s++) {
            EdgeRoute.SegmentOwner owner = route.getOwner(s);
            int top = layout.getRow(route.getUpper(s));
            int bottom = layout.getRow(route.getLower(s));
            int from = route.getUpperColumn(s);
            int to = route.getLowerColumn(s);

            if (!route.bends(s)) {
                vertical(canvas, from, top + 1, bottom - 1, owner);
            } else {
                int bend = route.getBendRow(s);
                int toward = to > from ? Canvas.RIGHT : Canvas.LEFT;
                int back = to > from ? Canvas.LEFT : Canvas.RIGHT;
                vertical(canvas, from, top + 1, bend - 1, owner);
                canvas.connect(bend, from, Canvas.UP | toward, owner);
                for (int col = Math.min(from, to) + 1; col < Math.max(from, to); col++) {
                    canvas.connect(bend, col, Canvas.LEFT | Canvas.RIGHT, owner);
                }
                canvas.connect(bend, to, back | Canvas.DOWN, owner);
                vertical(canvas, to, bend + 1, bottom - 1, owner);
            }

            LayoutVertex lower = route.getLower(s);
            if (lower.isVirtual()) {
                canvas.connect(bottom, to, Canvas.UP | Canvas.DOWN, owner);
            }
        }
    }

    private static void vertical(Canvas canvas, int column, int fromRow, int toRow, Canvas.PathOwner owner) {
        for (int row = fromRow; row <= toRow; row++) {
            canvas.connect(row, column, Canvas.UP | Canvas.DOWN, owner);
        }
    }

    /**
     * 方向标记。仅有向下流向时在靠近目标处画向下箭头；
     * 回边在离开下层节点和进入上层节点的两段上各画一个向上箭头；
     * 同一路径上两个方向都有时，下端画向下箭头，上端画向上箭头。
     */
    private void paintMarkers(Canvas canvas, EdgeRoute route, GraphLayout layout) {
        boolean down = route.hasDownwardFlow();
        boolean up = route.hasUpwardFlow();
        if (down && up) {
            markNearUpper(canvas, route, layout);
            markNearLower(canvas, route, layout, true);
        } else if (down) {
            markNearLower(canvas, route, layout, true);
        } else if (up) {
            markNearLower(canvas, route, layout, false);
            markNearUpper(canvas, route, layout);
        }
    }

    /**
     * 在最后一段靠近下端点的竖线中点画标记 (取靠下的中点)。
     * 竖线为空时退到水平走线的中点，水平走线没有内部单元格时画在拐角上。
     */
    private void markNearLower(Canvas canvas, EdgeRoute route, GraphLayout layout, boolean downward) {
        int s = route.getSegmentCount() - 1;
        int bottom = layout.getRow(route.getLower(s));
        int from = route.getUpperColumn(s);
        int to = route.getLowerColumn(s);
        int runStart = route.bends(s) ? route.getBendRow(s) + 1 : layout.getRow(route.getUpper(s)) + 1;
        int runEnd = bottom - 1;
        char vertical = glyphs.get(downward ? Glyph.ARROW_DOWN : Glyph.ARROW_UP);

        if (runStart <= runEnd) {
            int row = nearestClear(runStart, runEnd, (runStart + runEnd + 1) / 2, 1, r -> canvas.isCrossing(r, to));
            canvas.putMarker(row, to, vertical);
            return;
        }
        // 下段竖线为空，说明该段必然拐弯
        markHorizontal(canvas, route.getBendRow(s), from, to, downward ? to : from, vertical);
    }

    /**
     * 在第一段靠近上端点的竖线中点画向上箭头 (取靠上的中点)。
     */
    private void markNearUpper(Canvas canvas, EdgeRoute route, GraphLayout layout) {
        int top = layout.getRow(route.getUpper(0));
        int from = route.getUpperColumn(0);
        int to = route.getLowerColumn(0);
        int runStart = top + 1;
        int runEnd = route.bends(0) ? route.getBendRow(0) - 1 : layout.getRow(route.getLower(0)) - 1;
        char arrowUp = glyphs.get(Glyph.ARROW_UP);

        if (runStart <= runEnd) {
            int row = nearestClear(runStart, runEnd, (runStart + runEnd) / 2, -1, r -> canvas.isCrossing(r, from));
            canvas.putMarker(row, from, arrowUp);
            return;
        }
        markHorizontal(canvas, route.getBendRow(0), from, to, from, arrowUp);
    }

    /**
     * 在水平走线内部的中点画指向 target 列的左右箭头；没有内部单元格时在 target 一侧的拐角上画 fallback。
     */
    private void markHorizontal(Canvas canvas, int row, int from, int to, int target, char fallback) {
        int lo = Math.min(from, to) + 1;
        int hi = Math.max(from, to) - 1;
        if (lo > hi) {
            canvas.putMarker(row, target, fallback);
            return;
        }
        boolean pointsRight = target > Math.min(from, to);
        int preferred = pointsRight ? (lo + hi + 1) / 2 : (lo + hi) / 2;
        int col = nearestClear(lo, hi, preferred, pointsRight ? 1 : -1, c -> canvas.isCrossing(row, c));
        canvas.putMarker(row, col, glyphs.get(pointsRight ? Glyph.ARROW_RIGHT : Glyph.ARROW_LEFT));
    }

    /**
     * 在 [start, end] 中找离 preferred 最近、不是交叉的位置，距离相同时优先 step 方向。
     * 整段都是交叉时返回 preferred。
     */
    private static int nearestClear(int start, int end, int preferred, int step, IntPredicate crossing) {
        if (!crossing.test(preferred)) {
            return preferred;
        }
        for (int d = 1; d <= end - start; d++) {
            int toward = preferred + step * d;
            if (toward >= start && toward <= end && !crossing.test(toward)) {
                return toward;
            }
            int away = preferred - step * d;
            if (away >= start && away <= end && !crossing.test(away)) {
                return away;
            }
        }
        return preferred;
    }

    private void paintSelfLoops(Canvas canvas, GraphLayout layout) {
        Set<String> painted = new HashSet<>();
        char loop = glyphs.get(Glyph.SELF_LOOP);
        for (GraphEdge edge : layout.getLayeredGraph().getSelfLoops()) {
            if (!painted.add(edge.getSource())) {
                continue;
            }
            LayoutVertex vertex = layout.getLayeredGraph().getVertex(edge.getSource());
            canvas.putMarker(layout.getRow(vertex), layout.getX(vertex) + layout.getWidth(vertex), loop);
        }
    }

    /**
     * 同一上端点、同一连接列出发的拐弯线段，共享一行水平走线。
     */
    private static final class Bundle {
        private final List<EdgeRoute> routes = new ArrayList<>();
        private final List<Integer> segments = new ArrayList<>();
        private int start = Integer.MAX_VALUE;
        private int end = Integer.MIN_VALUE;

        void add(EdgeRoute route, int segment) {
            routes.add(route);
            segments.add(segment);
            start = Math.min(start, Math.min(route.getUpperColumn(segment), route.getLowerColumn(segment)));
            end = Math.max(end, Math.max(route.getUpperColumn(segment), route.getLowerColumn(segment)));
        }

        void applyRow(int row) {
            for (int i = 0; i < routes.size(); i++) {
                routes.get(i).setBendRow(segments.get(i), row);
            }
        }
    }
}
