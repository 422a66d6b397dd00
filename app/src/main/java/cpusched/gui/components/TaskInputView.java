package cpusched.gui.components;

import cpusched.Exception.SchedulingException;
import cpusched.kernel.process.Task;
import cpusched.kernel.process.TaskRegistry;
import javafx.collections.FXCollections;
import javafx.geometry.Insets;
import javafx.scene.control.Alert;
import javafx.scene.control.Button;
import javafx.scene.control.Label;
import javafx.scene.control.ListView;
import javafx.scene.control.TextField;
import javafx.scene.layout.GridPane;
import javafx.scene.layout.HBox;
import javafx.scene.layout.Priority;
import javafx.scene.layout.VBox;

import java.util.ArrayList;
import java.util.List;

/**
 * Task list with a small form to add and remove tasks.
 */
public class TaskInputView extends VBox {

    private final TaskRegistry registry;
    private final ListView<String> taskList = new ListView<>();
    private final TextField txtPid = new TextField();
    private final TextField txtArrival = new TextField("0");
    private final TextField txtBurst = new TextField("1");
    private final TextField txtPriority = new TextField("0");
    private final TextField txtDeps = new TextField();
    private Runnable onChange = () -> { };

    public TaskInputView(TaskRegistry registry) {
        this.registry = registry;
        this.setSpacing(5);
        this.setPadding(new Insets(5));

        GridPane form = new GridPane();
        form.setHgap(5);
        form.setVgap(5);
        String[] headers = { "PID", "Arrival", "Burst", "Priority", "After (ids)" };
        TextField[] fields = { txtPid, txtArrival, txtBurst, txtPriority, txtDeps };
        for (int i = 0; i < headers.length; i++) {
            fields[i].setPrefColumnCount(i == 4 ? 8 : 4);
            form.add(new Label(headers[i]), i, 0);
            form.add(fields[i], i, 1);
        }

        Button btnAdd = new Button("Add Task");
        btnAdd.setOnAction(e -> addFromForm());
        Button btnRemove = new Button("Remove Selected");
        btnRemove.setOnAction(e -> removeSelected());

        VBox.setVgrow(taskList, Priority.ALWAYS);
        this.getChildren().addAll(new Label("Tasks"), taskList, form, new HBox(5, btnAdd, btnRemove));
        refresh();
    }

    private void addFromForm() {
        try {
            List<String> deps = new ArrayList<>();
            for (String dep : txtDeps.getText().split("[,\\s]+")) {
                if (!dep.isBlank()) {
                    deps.add(dep.trim());
                }
            }
            Task task = new Task(txtPid.getText().trim(),
                    Integer.parseInt(txtArrival.getText().trim()),
                    Integer.parseInt(txtBurst.getText().trim()),
                    Integer.parseInt(txtPriority.getText().trim()),
                    deps);
            registry.add(task);
            System.out.println("GUI: Added task " + task.getId());
            refresh();
            onChange.run();
        } catch (NumberFormatException e) {
            showError("Arrival, burst and priority must be integers");
        } catch (SchedulingException e) {
            showError(e.getMessage());
        }
    }

    private void removeSelected() {
        int index = taskList.getSelectionModel().getSelectedIndex();
        if (index >= 0) {
            String id = registry.getTasks().get(index).getId();
            registry.remove(id);
            System.out.println("GUI: Removed task " + id);
            refresh();
            onChange.run();
        }
    }

    /**
     * Called after the form adds or removes a task.
     */
    public void setOnChange(Runnable onChange) {
        this.onChange = onChange;
    }

    /**
     * Reload the list from the registry and propose the next free PID.
     */
    public void refresh() {
        List<String> rows = new ArrayList<>();
        for (Task task : registry.getTasks()) {
            rows.add(task.toString());
        }
        taskList.setItems(FXCollections.observableArrayList(rows));

        int n = registry.size() + 1;
        while (registry.contains("P" + n)) {
            n++;
        }
        txtPid.setText("P" + n);
    }

    private static void showError(String message) {
        Alert alert = new Alert(Alert.AlertType.ERROR, message);
        alert.setHeaderText("Invalid task");
        alert.showAndWait();
    }
}
