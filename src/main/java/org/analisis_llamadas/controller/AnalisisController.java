package org.analisis_llamadas.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.analisis_llamadas.component.reporte.ReporteExcelGenerator;
import org.analisis_llamadas.component.reporte.VistasReporte;
import org.analisis_llamadas.dto.FiltroFechasDTO;
import org.analisis_llamadas.dto.RespuestaAnalisisDTO;
import org.analisis_llamadas.enums.EtapaAnalisis;
import org.analisis_llamadas.exception.AnalisisException;
import org.analisis_llamadas.exception.FiltroFechasInvalidoException;
import org.analisis_llamadas.exception.SinCategoriasException;
import org.analisis_llamadas.model.ResultadoAnalisis;
import org.analisis_llamadas.service.ArchivosSubidosService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Back end del dashboard: análisis de archivos subidos y descarga del reporte.
 *
 * No guarda estado entre peticiones; cada petición vuelve a analizar los
 * archivos que recibe.
 */
@Slf4j
@RestController
@RequestMapping("/api/analisis")
@CrossOrigin(origins = "*", maxAge = 3600)
public class AnalisisController {

    static final MediaType MEDIA_TYPE_XLSX =
            MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private static final DateTimeFormatter FORMATO_NOMBRE_REPORTE = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    @Autowired
    private ArchivosSubidosService archivosSubidosService;

    @Autowired
    private VistasReporte vistasReporte;

    @Autowired
    private ReporteExcelGenerator reporteExcelGenerator;

    @Autowired
    private ObjectMapper objectMapper;

    // =============== ENDPOINTS ===============

    /**
     * Analiza los archivos subidos y devuelve métricas y vistas.
     * La fecha de fin incluye el día completo.
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Object> analizar(
            @RequestParam("archivos") List<MultipartFile> archivos,
            @RequestParam(value = "fechaInicio", required = false) String fechaInicio,
            @RequestParam(value = "fechaFin", required = false) String fechaFin) {

        try {
            log.info("Iniciando análisis - Archivos: {}, Período: {} a {}", archivos.size(), fechaInicio, fechaFin);

            ResultadoAnalisis resultado = ejecutarAnalisis(archivos, fechaInicio, fechaFin);
            RespuestaAnalisisDTO respuesta = vistasReporte.respuestaCompleta(resultado);

            log.info("✅ Análisis completado: {} filas procesadas", resultado.getTotalFilas());
            return ResponseEntity.ok(respuesta);

        } catch (RuntimeException e) {
            return ResponseEntity.status(estadoPara(e))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(crearErrorResponse(e));
        }
    }

    /**
     * Analiza los archivos subidos y devuelve el reporte ejecutivo en Excel.
     */
    @PostMapping(value = "/reporte-excel", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<byte[]> descargarReporteExcel(
            @RequestParam("archivos") List<MultipartFile> archivos,
            @RequestParam(value = "fechaInicio", required = false) String fechaInicio,
            @RequestParam(value = "fechaFin", required = false) String fechaFin) {

        try {
            ResultadoAnalisis resultado = ejecutarAnalisis(archivos, fechaInicio, fechaFin);
            byte[] contenido = reporteExcelGenerator.generar(resultado);

            String nombre = "reporte_categorias_" + LocalDateTime.now().format(FORMATO_NOMBRE_REPORTE) + ".xlsx";
            log.info("Descarga completada exitosamente - {}: {} bytes", nombre, contenido.length);

            return ResponseEntity.ok()
                    .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + nombre + "\"")
                    .contentType(MEDIA_TYPE_XLSX)
                    .body(contenido);

        } catch (RuntimeException e) {
            return ResponseEntity.status(estadoPara(e))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(crearErrorBytes(e));
        }
    }

    // =============== AUXILIARES ===============

    private ResultadoAnalisis ejecutarAnalisis(List<MultipartFile> archivos, String fechaInicio, String fechaFin) {
        FiltroFechasDTO filtro = FiltroFechasDTO.desdeTexto(fechaInicio, fechaFin, true);
        return archivosSubidosService.analizar(archivos, filtro);
    }

    private HttpStatus estadoPara(RuntimeException e) {
        if (e instanceof FiltroFechasInvalidoException) {
            log.warn("Filtro de fechas inválido: {}", e.getMessage());
            return HttpStatus.BAD_REQUEST;
        }
        if (e instanceof SinCategoriasException) {
            log.warn("Sin categorías: {}", e.getMessage());
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        if (e instanceof AnalisisException
                && ((AnalisisException) e).getEtapa() == EtapaAnalisis.VALIDACION) {
            log.warn("Petición inválida: {}", e.getMessage());
            return HttpStatus.BAD_REQUEST;
        }
        log.error("Error en análisis: {}", e.getMessage(), e);
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private Map<String, Object> crearErrorResponse(RuntimeException e) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", tituloError(e));
        error.put("detalle", e instanceof AnalisisException ? ((AnalisisException) e).getDetalle() : e.getMessage());
        error.put("timestamp", LocalDateTime.now().toString());
        return error;
    }

    private byte[] crearErrorBytes(RuntimeException e) {
        try {
            return objectMapper.writeValueAsBytes(crearErrorResponse(e));
        } catch (JsonProcessingException ex) {
            log.warn("No se pudo serializar la respuesta de error: {}", ex.getMessage());
            return "{\"error\":\"Error interno\",\"detalle\":\"No se pudo generar respuesta de error\"}"
                    .getBytes(StandardCharsets.UTF_8);
        }
    }

    private String tituloError(RuntimeException e) {
        if (e instanceof FiltroFechasInvalidoException) {
            return "Filtro de fechas inválido";
        }
        if (e instanceof SinCategoriasException) {
            return "No se encontraron categorías";
        }
        if (e instanceof AnalisisException) {
            AnalisisException ae = (AnalisisException) e;
            return ae.getEtapa() != null ? "Error en " + ae.getEtapa().getDescripcion() : "Error en análisis";
        }
        return "Error interno del servidor";
    }
}
