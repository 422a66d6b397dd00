package cpusched.gui.components;

import cpusched.kernel.SimulationResult;
import cpusched.metrics.MetricsRecord;
import cpusched.metrics.TaskMetrics;
import javafx.beans.property.ReadOnlyObjectWrapper;
import javafx.collections.FXCollections;
import javafx.geometry.Insets;
import javafx.scene.control.Label;
import javafx.scene.control.TableColumn;
import javafx.scene.control.TableView;
import javafx.scene.layout.GridPane;
import javafx.scene.layout.Priority;
import javafx.scene.layout.VBox;

import java.util.function.Function;

/**
 * Per-task results table plus the aggregate figures.
 */
public class MetricsView extends VBox {

    private final Label lblAlgorithm = new Label("Algorithm: N/A");
    private final Label lblWait = new Label("N/A");
    private final Label lblTurn = new Label("N/A");
    private final Label lblResponse = new Label("N/A");
    private final Label lblCpu = new Label("N/A");
    private final Label lblThroughput = new Label("N/A");
    private final TableView<TaskMetrics> table = new TableView<>();

    public MetricsView() {
        this.setSpacing(5);
        this.setPadding(new Insets(5));
        lblAlgorithm.setStyle("-fx-font-weight: bold; -fx-font-size: 14px;");

        GridPane grid = new GridPane();
        grid.setHgap(10);
        grid.setVgap(3);
        grid.addRow(0, new Label("Avg Waiting Time:"), lblWait);
        grid.addRow(1, new Label("Avg Turnaround Time:"), lblTurn);
        grid.addRow(2, new Label("Avg Response Time:"), lblResponse);
        grid.addRow(3, new Label("CPU Utilization:"), lblCpu);
        grid.addRow(4, new Label("Throughput:"), lblThroughput);

        table.getColumns().add(column("PID", m -> m.taskId));
        table.getColumns().add(column("Start", m -> m.startTime));
        table.getColumns().add(column("End", m -> m.finishTime));
        table.getColumns().add(column("Waiting", TaskMetrics::getWaitingTime));
        table.getColumns().add(column("Turnaround", TaskMetrics::getTurnaroundTime));
        table.getColumns().add(column("Response", TaskMetrics::getResponseTime));
        table.setColumnResizePolicy(TableView.CONSTRAINED_RESIZE_POLICY);
        VBox.setVgrow(table, Priority.ALWAYS);

        this.getChildren().addAll(lblAlgorithm, grid, table);
    }

    public void show(SimulationResult result) {
        MetricsRecord metrics = result.getMetrics();
        lblAlgorithm.setText("Algorithm: " + result.getAlgorithmName());
        lblWait.setText(String.format("%.2f", metrics.getAverageWaitingTime()));
        lblTurn.setText(String.format("%.2f", metrics.getAverageTurnaroundTime()));
        lblResponse.setText(String.format("%.2f", metrics.getAverageResponseTime()));
        lblCpu.setText(String.format("%.2f%%", metrics.getCpuUtilization() * 100));
        lblThroughput.setText(String.format("%.4f", metrics.getThroughput()));
        table.setItems(FXCollections.observableArrayList(metrics.getTasks()));
    }

    public void clear() {
        lblAlgorithm.setText("Algorithm: N/A");
        for (Label label : new Label[] { lblWait, lblTurn, lblResponse, lblCpu, lblThroughput }) {
            label.setText("N/A");
        }
        table.getItems().clear();
    }

    private static <T> TableColumn<TaskMetrics, T> column(String title, Function<TaskMetrics, T> getter) {
        TableColumn<TaskMetrics, T> col = new TableColumn<>(title);
        col.setCellValueFactory(cell -> new ReadOnlyObjectWrapper<>(getter.apply(cell.getValue())));
        return col;
    }
}
