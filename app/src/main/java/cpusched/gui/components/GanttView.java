package cpusched.gui.components;

import cpusched.kernel.GanttSegment;
import javafx.geometry.Insets;
import javafx.geometry.VPos;
import javafx.scene.canvas.Canvas;
import javafx.scene.canvas.GraphicsContext;
import javafx.scene.control.Label;
import javafx.scene.control.ScrollPane;
import javafx.scene.layout.VBox;
import javafx.scene.paint.Color;
import javafx.scene.text.TextAlignment;

import java.util.ArrayList;
import java.util.List;

/**
 * Draws a Gantt chart of the segments, optionally clipped at a playback time.
 */
public class GanttView extends VBox {
    private static final double UNIT_WIDTH = 28;
    private static final double BAR_HEIGHT = 40;
    private static final double MARGIN = 10;

    private final Canvas canvas;
    private final Label lblTitle;
    private List<GanttSegment> segments = new ArrayList<>();

    public GanttView() {
        this.setSpacing(5);
        this.setPadding(new Insets(5));

        lblTitle = new Label("Gantt Chart");
        lblTitle.setStyle("-fx-font-weight: bold;");
        canvas = new Canvas(600, BAR_HEIGHT + 3 * MARGIN + 14);

        ScrollPane scroll = new ScrollPane(canvas);
        scroll.setFitToHeight(true);
        this.getChildren().addAll(lblTitle, scroll);
    }

    public void setSegments(String title, List<GanttSegment> segments) {
        this.segments = new ArrayList<>(segments);
        lblTitle.setText("Gantt Chart: " + title);
        update(Integer.MAX_VALUE);
    }

    /**
     * Redraw, showing only the part of the timeline before {@code upTo}.
     */
    public void update(int upTo) {
        int makespan = segments.isEmpty() ? 0 : segments.get(segments.size() - 1).getEnd();
        canvas.setWidth(Math.max(600, 2 * MARGIN + makespan * UNIT_WIDTH));

        GraphicsContext g = canvas.getGraphicsContext2D();
        g.clearRect(0, 0, canvas.getWidth(), canvas.getHeight());
        g.setTextAlign(TextAlignment.CENTER);
        g.setTextBaseline(VPos.CENTER);

        for (GanttSegment segment : segments) {
            if (segment.getStart() >= upTo) {
                break;
            }
            int end = Math.min(segment.getEnd(), upTo);
            double x = MARGIN + segment.getStart() * UNIT_WIDTH;
            double w = (end - segment.getStart()) * UNIT_WIDTH;

            g.setFill(segment.isIdle() ? Color.LIGHTGRAY : colorFor(segment.getTaskId()));
            g.fillRect(x, MARGIN, w, BAR_HEIGHT);
            g.setStroke(Color.DIMGRAY);
            g.strokeRect(x, MARGIN, w, BAR_HEIGHT);

            g.setFill(Color.BLACK);
            g.fillText(segment.getLabel(), x + w / 2, MARGIN + BAR_HEIGHT / 2);
            g.fillText(String.valueOf(segment.getStart()), x, MARGIN * 2 + BAR_HEIGHT + 4);
            g.fillText(String.valueOf(end), x + w, MARGIN * 2 + BAR_HEIGHT + 4);
        }
    }

    private static Color colorFor(String taskId) {
        double hue = Math.floorMod(taskId.hashCode() * 47, 360);
        return Color.hsb(hue, 0.45, 0.95);
    }
}
