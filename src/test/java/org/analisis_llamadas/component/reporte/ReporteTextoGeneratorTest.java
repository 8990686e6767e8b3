package org.analisis_llamadas.component.reporte;

import org.analisis_llamadas.config.AnalisisProperties;
import org.analisis_llamadas.model.AnalisisDetallado;
import org.analisis_llamadas.model.ContadorFrecuencias;
import org.analisis_llamadas.model.ResultadoAnalisis;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class ReporteTextoGeneratorTest {

    private static final String LINEA_DOBLE = new String(new char[100]).replace('\0', '=');

    private AnalisisProperties properties;
    private ReporteTextoGenerator generator;

    @BeforeEach
    void setUp() {
        properties = new AnalisisProperties();
        generator = new ReporteTextoGenerator(properties, new VistasReporte(properties));
    }

    @Test
    void deberiaIncluirEncabezadoYTodasLasCategorias() {
        // WHEN
        String reporte = generator.generar(ResultadosPrueba.completo());

        // THEN
        assertThat(reporte).startsWith(LINEA_DOBLE + "\n");
        assertThat(reporte).endsWith(LINEA_DOBLE);
        assertThat(reporte)
                .contains("Archivos procesados: 2\n")
                .contains("Filas totales analizadas: 20\n")
                .contains("Categorías generales únicas encontradas: 4\n")
                .contains("Cobertura de top 50 categorías generales: 100.0%\n")
                .contains("📊 TODAS LAS CATEGORÍAS GENERALES ENCONTRADAS:")
                .contains(String.format(Locale.ROOT, "%2d. %-50s %4d (%4.1f%%)", 1, "Red", 12L, 60.0))
                .contains(String.format(Locale.ROOT, "%2d. %-50s %4d (%4.1f%%)", 4, "Varios", 1L, 5.0))
                .contains("Cobertura total de categorías generales: 100.0%");
    }

    @Test
    void deberiaDetallarSoloConteosYNoListasDeRegistros() {
        String reporte = generator.generar(ResultadosPrueba.completo());

        assertThat(reporte)
                .contains("ANÁLISIS DETALLADO DE CATEGORÍAS Y SUBTIPOS")
                .contains("🔍 ANÁLISIS DE 'CATEGORIA_ESPECIFICA':\nValores únicos encontrados: 2\n")
                .contains("🔍 ANÁLISIS DE 'CATEGORIA_COMBINADA':")
                .contains(String.format(Locale.ROOT, "%3d. %-45s %4d (%5.1f%%)", 1, "Lenta", 8L, 40.0))
                .doesNotContain("CATEGORIA_COMBINADA_DETALLE")
                .doesNotContain("AGENTE_INSTALADOR_DETALLE");
    }

    @Test
    void deberiaIndicarAusenciaDeCategorias() {
        String reporte = generator.generar(ResultadosPrueba.vacio());

        assertThat(reporte)
                .contains("No se encontraron categorías generales para mostrar.")
                .doesNotContain("Cobertura")
                .doesNotContain("ANÁLISIS DETALLADO");
    }

    @Test
    void deberiaFormatearMilesConComa() {
        ContadorFrecuencias generales = new ContadorFrecuencias();
        generales.incrementar("Red", 1234567L);
        ResultadoAnalisis grande = new ResultadoAnalisis(generales, 1234567L, AnalisisDetallado.vacio(), 1);

        assertThat(generator.generar(grande)).contains("Filas totales analizadas: 1,234,567\n");
    }

    @Test
    void deberiaTruncarValoresLargos() {
        String largo = "Problema de conectividad intermitente en horario nocturno";

        assertThat(generator.truncar(largo)).isEqualTo(largo.substring(0, 45) + "...");
        assertThat(generator.truncar("Corto")).isEqualTo("Corto");
    }
}
