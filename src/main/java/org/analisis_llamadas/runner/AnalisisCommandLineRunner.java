package org.analisis_llamadas.runner;

import lombok.extern.slf4j.Slf4j;
import org.analisis_llamadas.component.reporte.ReporteExcelGenerator;
import org.analisis_llamadas.component.reporte.ReporteTextoGenerator;
import org.analisis_llamadas.config.AnalisisProperties;
import org.analisis_llamadas.dto.FiltroFechasDTO;
import org.analisis_llamadas.exception.AnalisisException;
import org.analisis_llamadas.model.ResultadoAnalisis;
import org.analisis_llamadas.service.AnalisisCategoriasService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Ejecución por línea de comandos.
 *
 * <pre>
 *   --files=enero.xlsx,febrero.xlsx    archivos explícitos
 *   --pattern=*AGENTES*.xlsx           patrón dentro del directorio de resultados
 *   --results-dir=/ruta/resultados     directorio donde buscar con --pattern
 *   --output=reporte.xlsx|reporte.txt  destino; sin él se imprime el reporte
 *   --start-date=YYYY-MM-DD --end-date=YYYY-MM-DD
 *   --verbose | -v
 * </pre>
 *
 * Código de salida 0 si el análisis termina, 1 ante cualquier fallo.
 */
@Slf4j
@Component
public class AnalisisCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String OPCION_ARCHIVOS = "files";
    static final String OPCION_PATRON = "pattern";
    static final String OPCION_DIRECTORIO = "results-dir";
    static final String OPCION_SALIDA = "output";
    static final String OPCION_FECHA_INICIO = "start-date";
    static final String OPCION_FECHA_FIN = "end-date";
    static final String OPCION_VERBOSE = "verbose";

    private static final String PAQUETE_APLICACION = "org.analisis_llamadas";

    @Autowired
    private AnalisisCategoriasService analisisCategoriasService;

    @Autowired
    private ReporteTextoGenerator reporteTextoGenerator;

    @Autowired
    private ReporteExcelGenerator reporteExcelGenerator;

    @Autowired
    private AnalisisProperties properties;

    private int codigoSalida = 0;

    /**
     * Indica si los argumentos piden una ejecución por línea de comandos.
     */
    public static boolean esInvocacionCli(String[] args) {
        if (args == null) {
            return false;
        }
        for (String arg : args) {
            if (arg.startsWith("--" + OPCION_ARCHIVOS) || arg.startsWith("--" + OPCION_PATRON)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(OPCION_ARCHIVOS) && !args.containsOption(OPCION_PATRON)) {
            return;
        }
        codigoSalida = ejecutar(args);
    }

    @Override
    public int getExitCode() {
        return codigoSalida;
    }

    /**
     * Ejecuta el análisis completo y devuelve el código de salida.
     */
    int ejecutar(ApplicationArguments args) {
        if (args.containsOption(OPCION_VERBOSE) || args.getNonOptionArgs().contains("-v")) {
            LoggingSystem.get(getClass().getClassLoader()).setLogLevel(PAQUETE_APLICACION, LogLevel.DEBUG);
        }

        try {
            // Fin del rango: medianoche del día indicado
            FiltroFechasDTO filtro = FiltroFechasDTO.desdeTexto(
                    valor(args, OPCION_FECHA_INICIO), valor(args, OPCION_FECHA_FIN), false);
            if (filtro.estaConfigurado()) {
                log.info("Filtro de fechas configurado: {}", filtro.describirPeriodo());
            }

            List<Path> archivos = resolverArchivos(args);
            if (archivos == null) {
                return 1;
            }
            if (archivos.isEmpty()) {
                log.error("No se encontraron archivos Excel para procesar");
                return 1;
            }

            log.info("Procesando {} archivo(s) Excel...", archivos.size());
            ResultadoAnalisis resultado = analisisCategoriasService.analizarArchivos(archivos, filtro);

            if (!resultado.tieneCategorias()) {
                log.error("No se pudieron extraer categorías de ningún archivo");
                return 1;
            }

            entregarReporte(resultado, valor(args, OPCION_SALIDA));
            log.info("Análisis completado exitosamente");
            return 0;

        } catch (AnalisisException e) {
            log.error(e.getMessageDetallado());
            return 1;
        } catch (RuntimeException e) {
            log.error("Error durante la ejecución: {}", e.getMessage(), e);
            return 1;
        }
    }

    // =============== AUXILIARES ===============

    /**
     * Archivos explícitos o encontrados por patrón. Null si algún archivo
     * explícito no existe.
     */
    private List<Path> resolverArchivos(ApplicationArguments args) {
        String archivosExplicitos = valor(args, OPCION_ARCHIVOS);
        if (archivosExplicitos != null) {
            List<Path> archivos = new ArrayList<>();
            for (String nombre : archivosExplicitos.split(",")) {
                if (nombre.trim().isEmpty()) {
                    continue;
                }
                Path archivo = Paths.get(nombre.trim());
                if (!Files.exists(archivo)) {
                    log.error("El archivo {} no existe", archivo);
                    return null;
                }
                archivos.add(archivo);
            }
            return archivos;
        }

        String directorio = valor(args, OPCION_DIRECTORIO);
        Path raiz = Paths.get(directorio != null ? directorio : properties.getDirectorioResultados());
        return analisisCategoriasService.buscarArchivos(raiz, valor(args, OPCION_PATRON));
    }

    private void entregarReporte(ResultadoAnalisis resultado, String salida) {
        if (salida != null && salida.toLowerCase(Locale.ROOT).endsWith(".xlsx")) {
            reporteExcelGenerator.guardar(resultado, Paths.get(salida));
            return;
        }

        String reporte = reporteTextoGenerator.generar(resultado);
        if (salida == null) {
            System.out.println(reporte);
            return;
        }

        try {
            Files.write(Paths.get(salida), reporte.getBytes(StandardCharsets.UTF_8));
            log.info("Reporte guardado en: {}", salida);
        } catch (IOException e) {
            log.error("Error guardando reporte en {}: {}", salida, e.getMessage());
            System.out.println(reporte);
        }
    }

    private String valor(ApplicationArguments args, String opcion) {
        List<String> valores = args.getOptionValues(opcion);
        if (valores == null || valores.isEmpty()) {
            return null;
        }
        String valor = valores.get(0);
        return valor == null || valor.trim().isEmpty() ? null : valor.trim();
    }
}
