package com.titiplex.tracker;

import javafx.application.Application;
import javafx.fxml.FXMLLoader;
import javafx.scene.Parent;
import javafx.scene.Scene;
import javafx.stage.Stage;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

public class App extends Application {

    private ConfigurableApplicationContext context;

    public static void main(String[] args) {
        launch(args);
    }

    @Override
    public void init() {
        context = new SpringApplicationBuilder(SpringConfig.class)
                .web(WebApplicationType.NONE)
                .headless(false)
                .initializers(ctx -> ctx.getBeanFactory().registerSingleton("hostServices", getHostServices()))
                .run(getParameters().getRaw().toArray(new String[0]));
    }

    @Override
    public void start(Stage stage) throws Exception {
        FXMLLoader loader = new FXMLLoader(getClass().getResource("/fxml/main.fxml"));
        loader.setControllerFactory(context::getBean);
        Parent root = loader.load();
        stage.setTitle("Expense Tracker");
        stage.setScene(new Scene(root, 1100, 720));
        stage.show();
    }

    @Override
    public void stop() {
        context.close();
    }
}
