package cpusched.gui;

import cpusched.Exception.SchedulingException;
import cpusched.gui.components.ConsoleView;
import cpusched.gui.components.GanttView;
import cpusched.gui.components.MetricsView;
import cpusched.gui.components.TaskInputView;
import cpusched.gui.util.GuiOutputStream;
import cpusched.io.CsvExporter;
import cpusched.io.WorkloadGenerator;
import cpusched.io.WorkloadStore;
import cpusched.kernel.Simulation;
import cpusched.kernel.SimulationLog;
import cpusched.kernel.SimulationResult;
import cpusched.kernel.Simulator;
import cpusched.kernel.SimulatorConfig;
import cpusched.kernel.process.Task;
import cpusched.kernel.process.TaskRegistry;
import cpusched.metrics.MetricsCalculator;
import javafx.animation.AnimationTimer;
import javafx.geometry.Insets;
import javafx.geometry.Orientation;
import javafx.scene.Parent;
import javafx.scene.control.*;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.HBox;
import javafx.scene.layout.Priority;
import javafx.scene.layout.VBox;
import javafx.stage.FileChooser;
import javafx.stage.Window;
import javafx.util.StringConverter;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;

public class MainController {

    private final TaskRegistry registry;
    private final SimulatorConfig config;
    private final BorderPane root;

    // Components
    private TaskInputView taskInputView;
    private GanttView ganttView;
    private MetricsView metricsView;
    private ConsoleView consoleView;

    // Controls
    private ComboBox<SimulatorConfig.PolicyType> cmbPolicy;
    private Spinner<Integer> spnQuantum;
    private Slider speedSlider;
    private Label lblStatus;

    // Results
    private SimulationResult lastResult;
    // Step mode runs over its own copy so workload edits cannot reach it
    private TaskRegistry steppingRegistry;
    private Simulation stepping;
    private AnimationTimer playback;

    public MainController(TaskRegistry registry, SimulatorConfig config) {
        this.registry = registry;
        this.config = config;
        this.root = new BorderPane();
        initializeUI();
    }

    private void initializeUI() {
        // --- TOP: Toolbar ---
        HBox toolbar = new HBox(10);
        toolbar.setPadding(new Insets(10));
        toolbar.setStyle("-fx-background-color: #ddd; -fx-border-color: #bbb; -fx-border-width: 0 0 1 0;");

        cmbPolicy = new ComboBox<>();
        cmbPolicy.getItems().addAll(SimulatorConfig.PolicyType.values());
        cmbPolicy.setValue(config.getPolicyType());
        cmbPolicy.setConverter(new StringConverter<>() {
            @Override
            public String toString(SimulatorConfig.PolicyType policy) {
                return policy == null ? "" : policy.getDisplayName();
            }

            @Override
            public SimulatorConfig.PolicyType fromString(String text) {
                return null;
            }
        });

        spnQuantum = new Spinner<>(1, 100, config.getQuantum());
        spnQuantum.setPrefWidth(70);

        Button btnRun = new Button("Run Simulation");
        btnRun.setOnAction(e -> runSimulation());
        Button btnStep = new Button("Step");
        btnStep.setOnAction(e -> stepSimulation());
        Button btnPlay = new Button("Play");
        btnPlay.setOnAction(e -> startPlayback());

        Label lblSpeed = new Label("Delay (ms):");
        speedSlider = new Slider(50, 1000, 300);
        speedSlider.setShowTickLabels(true);
        speedSlider.setMajorTickUnit(250);

        lblStatus = new Label("Status: Ready");

        toolbar.getChildren().addAll(new Label("Policy:"), cmbPolicy, new Label("Quantum:"), spnQuantum,
                btnRun, btnStep, btnPlay, new Separator(Orientation.VERTICAL), lblSpeed, speedSlider,
                new Separator(Orientation.VERTICAL), lblStatus);

        // --- LEFT: Workload ---
        taskInputView = new TaskInputView(registry);
        taskInputView.setOnChange(this::workloadChanged);
        Button btnRandom = new Button("Random");
        btnRandom.setOnAction(e -> addRandomTasks());
        Button btnClear = new Button("Clear All");
        btnClear.setOnAction(e -> {
            registry.clear();
            taskInputView.refresh();
            workloadChanged();
            setStatus("Cleared all tasks");
        });
        Button btnSave = new Button("Save");
        btnSave.setOnAction(e -> saveWorkload());
        Button btnLoad = new Button("Load");
        btnLoad.setOnAction(e -> loadWorkload());
        Button btnExport = new Button("Export CSV");
        btnExport.setOnAction(e -> exportCsv());

        VBox leftPane = new VBox(10, taskInputView, new HBox(5, btnRandom, btnClear, btnSave, btnLoad, btnExport));
        leftPane.setPadding(new Insets(10));
        VBox.setVgrow(taskInputView, Priority.ALWAYS);

        // --- CENTER: Results ---
        ganttView = new GanttView();
        metricsView = new MetricsView();
        VBox results = new VBox(10, ganttView, metricsView);
        results.setPadding(new Insets(10));
        VBox.setVgrow(metricsView, Priority.ALWAYS);

        SplitPane splitPane = new SplitPane(leftPane, results);
        splitPane.setDividerPositions(0.35);

        // BOTTOM: Console
        consoleView = new ConsoleView();
        consoleView.setPrefHeight(180);

        BorderPane centerLayout = new BorderPane();
        centerLayout.setCenter(splitPane);
        centerLayout.setBottom(consoleView);

        root.setTop(toolbar);
        root.setCenter(centerLayout);

        // Redirect System.out and System.err to ConsoleView
        PrintStream printStream = new PrintStream(new GuiOutputStream(consoleView.getOutputArea()), true);
        System.setOut(printStream);
        System.setErr(printStream);
        System.out.println("GUI: Console Output Redirected.");
    }

    private SimulatorConfig currentConfig() {
        SimulatorConfig runConfig = new SimulatorConfig(config);
        runConfig.setPolicyType(cmbPolicy.getValue());
        runConfig.setQuantum(spnQuantum.getValue());
        return runConfig;
    }

    private SimulationLog consoleLog() {
        SimulationLog log = new SimulationLog();
        log.addListener(consoleView::appendLine);
        return log;
    }

    private void runSimulation() {
        stopPlayback();
        stepping = null;
        if (registry.isEmpty()) {
            addRandomTasks();
        }
        try {
            lastResult = Simulator.simulate(registry, currentConfig(), consoleLog());
            ganttView.setSegments(lastResult.getAlgorithmName(), lastResult.getSegments());
            metricsView.show(lastResult);
            setStatus("Simulation completed");
        } catch (SchedulingException e) {
            fail("Simulation failed", e);
        }
    }

    /**
     * Advance a live simulation by one scheduling decision.
     */
    private void stepSimulation() {
        stopPlayback();
        try {
            if (stepping == null || stepping.isFinished()) {
                if (registry.isEmpty()) {
                    addRandomTasks();
                }
                steppingRegistry = registry.copy();
                stepping = new Simulation(steppingRegistry, currentConfig(), consoleLog());
                metricsView.clear();
            }
            boolean more = stepping.step();
            ganttView.setSegments(stepping.getScheduler().getName() + " (t=" + stepping.getTime() + ")",
                    stepping.getSegments());
            if (more) {
                setStatus("Step mode: t=" + stepping.getTime() + " " + stepping.getState());
            } else {
                lastResult = new SimulationResult(stepping.getScheduler().getName(), stepping.getSegments(),
                        MetricsCalculator.calculate(steppingRegistry, stepping.getSegments()),
                        stepping.getScheduler().getStats());
                metricsView.show(lastResult);
                setStatus("Step mode completed");
            }
        } catch (SchedulingException e) {
            stepping = null;
            steppingRegistry = null;
            fail("Step mode failed", e);
        }
    }

    /**
     * Replay the last result one time unit per tick of the delay slider.
     */
    private void startPlayback() {
        if (lastResult == null) {
            runSimulation();
            if (lastResult == null) {
                return;
            }
        }
        stopPlayback();
        ganttView.setSegments(lastResult.getAlgorithmName(), lastResult.getSegments());
        int makespan = lastResult.getMetrics().getMakespan();
        playback = new AnimationTimer() {
            private long lastTick = 0;
            private int shown = 0;

            @Override
            public void handle(long now) {
                if (now - lastTick < (long) (speedSlider.getValue() * 1_000_000)) {
                    return;
                }
                lastTick = now;
                ganttView.update(++shown);
                setStatus("Playback: t=" + shown + " / " + makespan);
                if (shown >= makespan) {
                    stop();
                }
            }
        };
        playback.start();
    }

    /**
     * Results and any step-mode run describe the old workload once it changes.
     */
    private void workloadChanged() {
        stopPlayback();
        stepping = null;
        steppingRegistry = null;
        lastResult = null;
        metricsView.clear();
    }

    private void stopPlayback() {
        if (playback != null) {
            playback.stop();
            playback = null;
        }
    }

    private void addRandomTasks() {
        try {
            int added = new WorkloadGenerator(System.nanoTime()).appendTo(registry);
            taskInputView.refresh();
            workloadChanged();
            setStatus("Added " + added + " random tasks");
        } catch (SchedulingException e) {
            fail("Random workload failed", e);
        }
    }

    private void saveWorkload() {
        File file = chooser("JSON files", "*.json").showSaveDialog(window());
        if (file == null) {
            return;
        }
        try {
            new WorkloadStore().save(registry, file.toPath());
            setStatus("Saved configuration to " + file);
        } catch (IOException e) {
            fail("Save failed", e);
        }
    }

    private void loadWorkload() {
        File file = chooser("JSON files", "*.json").showOpenDialog(window());
        if (file == null) {
            return;
        }
        try {
            TaskRegistry loaded = new WorkloadStore().load(file.toPath());
            registry.clear();
            for (Task task : loaded.getTasks()) {
                registry.add(task);
            }
            taskInputView.refresh();
            workloadChanged();
            setStatus("Loaded configuration from " + file);
        } catch (IOException | SchedulingException e) {
            fail("Load failed", e);
        }
    }

    private void exportCsv() {
        if (lastResult == null) {
            setStatus("Run a simulation before exporting");
            return;
        }
        File file = chooser("CSV files", "*.csv").showSaveDialog(window());
        if (file == null) {
            return;
        }
        try {
            CsvExporter.export(lastResult.getMetrics(), lastResult.getAlgorithmName(), file.toPath());
            setStatus("Exported metrics to " + file);
        } catch (IOException e) {
            fail("Export failed", e);
        }
    }

    private static FileChooser chooser(String description, String pattern) {
        FileChooser chooser = new FileChooser();
        chooser.getExtensionFilters().add(new FileChooser.ExtensionFilter(description, pattern));
        return chooser;
    }

    private Window window() {
        return root.getScene() != null ? root.getScene().getWindow() : null;
    }

    private void setStatus(String status) {
        lblStatus.setText("Status: " + status);
    }

    private void fail(String title, Exception e) {
        System.err.println("GUI: " + title + ": " + e.getMessage());
        setStatus(title);
        Alert alert = new Alert(Alert.AlertType.ERROR, e.getMessage());
        alert.setHeaderText(title);
        alert.showAndWait();
    }

    public Parent getView() {
        return root;
    }
}
