package org.analisis_llamadas;

import org.analisis_llamadas.config.AnalisisProperties;
import org.analisis_llamadas.controller.AnalisisController;
import org.analisis_llamadas.runner.AnalisisCommandLineRunner;
import org.analisis_llamadas.service.AnalisisCategoriasService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class AppTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private AnalisisProperties properties;

    @Test
    void deberiaLevantarElContextoConLaConfiguracionDelYml() {
        assertThat(context.getBean(AnalisisCategoriasService.class)).isNotNull();
        assertThat(context.getBean(AnalisisController.class)).isNotNull();
        assertThat(context.getBean(AnalisisCommandLineRunner.class).getExitCode()).isZero();

        assertThat(properties.getExtensiones()).containsExactly("xlsx", "xls", "csv");
        assertThat(properties.getHojaDashboard()).isEqualTo("Dashboard_Ejecutivo");
    }
}
