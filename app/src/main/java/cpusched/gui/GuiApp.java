package cpusched.gui;

import cpusched.Exception.ConfigurationException;
import cpusched.kernel.SimulatorConfig;
import cpusched.kernel.process.TaskRegistry;
import javafx.application.Application;
import javafx.application.Platform;
import javafx.scene.Scene;
import javafx.stage.Stage;

public class GuiApp extends Application {

    @Override
    public void start(Stage primaryStage) {
        SimulatorConfig config;
        try {
            config = SimulatorConfig.loadDefault();
        } catch (ConfigurationException e) {
            System.err.println("GUI: Bad default configuration, using built-in values: " + e.getMessage());
            config = new SimulatorConfig();
        }

        MainController controller = new MainController(new TaskRegistry(), config);
        Scene scene = new Scene(controller.getView(), 1400, 900);

        primaryStage.setTitle("CPU Scheduler Simulator");
        primaryStage.setScene(scene);
        primaryStage.setOnCloseRequest(e -> Platform.exit());
        primaryStage.show();
    }

    public static void main(String[] args) {
        launch(args);
    }
}
