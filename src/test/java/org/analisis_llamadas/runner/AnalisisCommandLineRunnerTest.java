package org.analisis_llamadas.runner;

import org.analisis_llamadas.component.agregador.AgregadorFilas;
import org.analisis_llamadas.component.agregador.CalculadorDesgloseInstalador;
import org.analisis_llamadas.component.agregador.ConstructorRutas;
import org.analisis_llamadas.component.agregador.FiltradorFechas;
import org.analisis_llamadas.component.identificador.IdentificadorColumnas;
import org.analisis_llamadas.component.lector.LectorExcel;
import org.analisis_llamadas.component.parser.FechaParser;
import org.analisis_llamadas.component.reporte.ReporteExcelGenerator;
import org.analisis_llamadas.component.reporte.ReporteTextoGenerator;
import org.analisis_llamadas.component.reporte.VistasReporte;
import org.analisis_llamadas.config.AnalisisProperties;
import org.analisis_llamadas.service.AnalisisCategoriasService;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Arrays;

import static org.analisis_llamadas.DatosPrueba.escribirXlsx;
import static org.analisis_llamadas.DatosPrueba.fila;
import static org.assertj.core.api.Assertions.assertThat;

class AnalisisCommandLineRunnerTest {

    @TempDir
    Path directorio;

    private AnalisisCommandLineRunner runner;

    @BeforeEach
    void setUp() {
        AnalisisProperties properties = new AnalisisProperties();
        properties.setDirectorioResultados(directorio.toString());

        IdentificadorColumnas identificador = new IdentificadorColumnas();
        AgregadorFilas agregador = new AgregadorFilas(new LectorExcel(), identificador,
                new FiltradorFechas(identificador, new FechaParser()),
                new ConstructorRutas(), new CalculadorDesgloseInstalador());

        AnalisisCategoriasService service = new AnalisisCategoriasService();
        ReflectionTestUtils.setField(service, "agregadorFilas", agregador);
        ReflectionTestUtils.setField(service, "calculadorDesglose", new CalculadorDesgloseInstalador());
        ReflectionTestUtils.setField(service, "properties", properties);

        VistasReporte vistas = new VistasReporte(properties);

        runner = new AnalisisCommandLineRunner();
        ReflectionTestUtils.setField(runner, "analisisCategoriasService", service);
        ReflectionTestUtils.setField(runner, "reporteTextoGenerator", new ReporteTextoGenerator(properties, vistas));
        ReflectionTestUtils.setField(runner, "reporteExcelGenerator", new ReporteExcelGenerator(properties, vistas));
        ReflectionTestUtils.setField(runner, "properties", properties);
    }

    private Path llamadas() throws IOException {
        return escribirXlsx(directorio.resolve("llamadas.xlsx"),
                Arrays.asList("categoria_general", "categoria_especifica", "fecha"),
                fila("Red", "Lenta", LocalDateTime.of(2025, 1, 5, 9, 30)),
                fila("Red", "Caida", LocalDateTime.of(2025, 1, 20, 0, 0)),
                fila("Billing", null, LocalDateTime.of(2025, 2, 1, 8, 0)));
    }

    private int ejecutar(String... args) {
        return runner.ejecutar(new DefaultApplicationArguments(args));
    }

    @Test
    void deberiaEscribirReporteDeTexto() throws IOException {
        // GIVEN
        Path salida = directorio.resolve("reporte.txt");

        // WHEN
        int codigo = ejecutar("--files=" + llamadas(), "--output=" + salida);

        // THEN
        assertThat(codigo).isZero();
        String reporte = new String(Files.readAllBytes(salida), StandardCharsets.UTF_8);
        assertThat(reporte)
                .contains("Archivos procesados: 1")
                .contains("Filas totales analizadas: 3")
                .contains("🔍 ANÁLISIS DE 'CATEGORIA_COMBINADA':");
    }

    @Test
    void deberiaAplicarFinDeRangoHastaMedianoche() throws IOException {
        Path salida = directorio.resolve("filtrado.txt");

        int codigo = ejecutar("--files=" + llamadas(), "--output=" + salida,
                "--start-date=2025-01-01", "--end-date=2025-01-20");

        assertThat(codigo).isZero();
        assertThat(new String(Files.readAllBytes(salida), StandardCharsets.UTF_8))
                .contains("Filas totales analizadas: 2");
    }

    @Test
    void deberiaGuardarReporteExcelSegunExtension() throws IOException {
        Path salida = directorio.resolve("salida").resolve("reporte.xlsx");

        int codigo = ejecutar("--files=" + llamadas(), "--output=" + salida);

        assertThat(codigo).isZero();
        try (InputStream entrada = Files.newInputStream(salida);
             Workbook workbook = new XSSFWorkbook(entrada)) {
            assertThat(workbook.getSheet("Dashboard_Ejecutivo")).isNotNull();
        }
    }

    @Test
    void deberiaBuscarPorPatronEnElDirectorioDeResultados() throws IOException {
        llamadas();
        Path salida = directorio.resolve("patron.txt");

        int codigo = ejecutar("--pattern=llamadas*.xlsx", "--results-dir=" + directorio, "--output=" + salida);

        assertThat(codigo).isZero();
        assertThat(salida).exists();
    }

    @Test
    void deberiaFallarSiUnArchivoNoExiste() throws IOException {
        int codigo = ejecutar("--files=" + llamadas() + "," + directorio.resolve("falta.xlsx"));

        assertThat(codigo).isEqualTo(1);
    }

    @Test
    void deberiaFallarConFechaInvalida() throws IOException {
        assertThat(ejecutar("--files=" + llamadas(), "--start-date=2025-13-01")).isEqualTo(1);
        assertThat(ejecutar("--files=" + llamadas(), "--start-date=2025-02-01", "--end-date=2025-01-01"))
                .isEqualTo(1);
    }

    @Test
    void deberiaFallarSinArchivosNiCategorias() throws IOException {
        assertThat(ejecutar("--pattern=*.xlsx")).isEqualTo(1);

        Path numeros = escribirXlsx(directorio.resolve("numeros.xlsx"), Arrays.asList("id_llamada"), fila(1L));
        assertThat(ejecutar("--files=" + numeros)).isEqualTo(1);
    }

    @Test
    void deberiaIgnorarEjecucionSinOpcionesDeAnalisis() {
        runner.run(new DefaultApplicationArguments("--server.port=8080"));

        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    void deberiaDetectarInvocacionPorLineaDeComandos() {
        assertThat(AnalisisCommandLineRunner.esInvocacionCli(new String[]{"--files=a.xlsx"})).isTrue();
        assertThat(AnalisisCommandLineRunner.esInvocacionCli(new String[]{"--pattern=*.xlsx", "-v"})).isTrue();
        assertThat(AnalisisCommandLineRunner.esInvocacionCli(new String[]{"--server.port=8080"})).isFalse();
        assertThat(AnalisisCommandLineRunner.esInvocacionCli(null)).isFalse();
    }
}
