package org.analisis_llamadas.component.reporte;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.analisis_llamadas.config.AnalisisProperties;
import org.analisis_llamadas.dto.FilaInstaladorDTO;
import org.analisis_llamadas.dto.FilaRankingDTO;
import org.analisis_llamadas.dto.FilaResumenEjecutivoDTO;
import org.analisis_llamadas.dto.FilaRutaDTO;
import org.analisis_llamadas.dto.FilaSubcategoriaDTO;
import org.analisis_llamadas.enums.EtapaAnalisis;
import org.analisis_llamadas.exception.AnalisisException;
import org.analisis_llamadas.model.ResultadoAnalisis;
import org.analisis_llamadas.utils.FormatoNumeros;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Genera el libro Excel del reporte ejecutivo.
 *
 * Hoja "Dashboard_Ejecutivo": secciones apiladas (título en la fila r,
 * encabezados en r+2, datos a continuación) separadas por filas en blanco.
 * Hoja "Agentes_Instaladores": sólo cuando hay desglose por instalador.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReporteExcelGenerator {

    private static final int MAX_COLUMNAS_AUTOSIZE = 20;
    private static final int ANCHO_MINIMO = 8;
    private static final int ANCHO_MAXIMO = 80;

    private final AnalisisProperties properties;
    private final VistasReporte vistasReporte;

    /**
     * Genera el libro en memoria.
     *
     * @throws AnalisisException Si el libro no puede escribirse
     */
    public byte[] generar(ResultadoAnalisis resultado) {
        try (Workbook workbook = new XSSFWorkbook();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {

            CellStyle estiloEncabezado = crearEstiloEncabezado(workbook);
            escribirDashboard(workbook, estiloEncabezado, resultado);
            escribirInstaladores(workbook, estiloEncabezado, resultado);

            workbook.write(outputStream);
            byte[] bytes = outputStream.toByteArray();
            log.info("Reporte ejecutivo Excel generado en memoria: {} bytes", bytes.length);
            return bytes;

        } catch (IOException e) {
            throw new AnalisisException("Error generando el reporte Excel: " + e.getMessage(),
                    EtapaAnalisis.REPORTE, null, e);
        }
    }

    /**
     * Genera el libro y lo escribe en la ruta indicada.
     */
    public void guardar(ResultadoAnalisis resultado, Path destino) {
        byte[] contenido = generar(resultado);
        try {
            Path directorio = destino.toAbsolutePath().getParent();
            if (directorio != null) {
                Files.createDirectories(directorio);
            }
            Files.write(destino, contenido);
            log.info("📊 Reporte Excel guardado en: {}", destino);
        } catch (IOException e) {
            throw new AnalisisException("No se pudo escribir el reporte Excel: " + e.getMessage(),
                    EtapaAnalisis.REPORTE, destino.getFileName().toString(), e);
        }
    }

    // =============== HOJAS ===============

    private void escribirDashboard(Workbook workbook, CellStyle estiloEncabezado, ResultadoAnalisis resultado) {
        Sheet sheet = workbook.createSheet(properties.getHojaDashboard());

        List<SeccionTabla> secciones = Arrays.asList(
                seccionResumen(resultado),
                seccionKpis(resultado),
                seccionRutas(resultado),
                seccionSubcategorias(resultado));

        int filaActual = 0;
        int columnas = 0;
        for (SeccionTabla seccion : secciones) {
            sheet.createRow(filaActual).createCell(0).setCellValue(seccion.titulo);

            // Una tabla sin filas tampoco lleva encabezados
            if (seccion.filas != null && !seccion.filas.isEmpty()) {
                escribirTabla(sheet, filaActual + 2, seccion.encabezados, seccion.filas, estiloEncabezado);
                columnas = Math.max(columnas, seccion.encabezados.size());
            }

            // Una sección sin contenido ocupa una fila
            filaActual += (seccion.filas != null ? seccion.filas.size() : 1) + 4;
        }

        autoSizeColumns(sheet, Math.min(columnas, MAX_COLUMNAS_AUTOSIZE));
    }

    private void escribirInstaladores(Workbook workbook, CellStyle estiloEncabezado, ResultadoAnalisis resultado) {
        List<FilaInstaladorDTO> instaladores = vistasReporte.vistaInstaladores(resultado);
        if (instaladores.isEmpty()) {
            return;
        }

        List<String> encabezados = Arrays.asList("agente_instalador", "categoria_general", "categoria_especifica",
                "subtipo", "ruta_completa", "Frecuencia", "% del Agente");
        List<List<Object>> filas = new ArrayList<>(instaladores.size());
        for (FilaInstaladorDTO fila : instaladores) {
            filas.add(Arrays.<Object>asList(fila.getAgenteInstalador(), fila.getCategoriaGeneral(),
                    fila.getCategoriaEspecifica(), fila.getSubtipo(), fila.getRutaCompleta(),
                    fila.getFrecuencia(), fila.getPorcentajeAgenteTexto()));
        }

        Sheet sheet = workbook.createSheet(properties.getHojaInstaladores());
        escribirTabla(sheet, 0, encabezados, filas, estiloEncabezado);
        autoSizeColumns(sheet, encabezados.size());
        log.info("Añadida hoja '{}' con {} registros", properties.getHojaInstaladores(), filas.size());
    }

    // =============== SECCIONES ===============

    private SeccionTabla seccionResumen(ResultadoAnalisis resultado) {
        List<List<Object>> filas = new ArrayList<>();
        for (FilaResumenEjecutivoDTO fila : vistasReporte.resumenEjecutivo(resultado)) {
            filas.add(Arrays.<Object>asList(fila.getMetrica(), fila.getValor(), fila.getInsight()));
        }
        return new SeccionTabla("RESUMEN EJECUTIVO", Arrays.asList("Métrica", "Valor", "Insight"), filas);
    }

    private SeccionTabla seccionKpis(ResultadoAnalisis resultado) {
        List<List<Object>> filas = new ArrayList<>();
        for (FilaRankingDTO fila : vistasReporte.vistaRanking(resultado)) {
            filas.add(Arrays.<Object>asList(fila.getRanking(), fila.getCategoria(),
                    FormatoNumeros.miles(fila.getLlamadas()), FormatoNumeros.porcentaje(fila.getPorcentaje()),
                    fila.getImpactoOperativo().getEtiqueta()));
        }
        return new SeccionTabla("KPIs PRINCIPALES",
                Arrays.asList("Ranking", "Categoría Principal", "Volumen", "% del Total", "Impacto Operativo"), filas);
    }

    private SeccionTabla seccionRutas(ResultadoAnalisis resultado) {
        List<FilaRutaDTO> rutas = vistasReporte.vistaRutas(resultado);
        List<List<Object>> filas = null;
        if (!rutas.isEmpty()) {
            filas = new ArrayList<>(rutas.size());
            for (FilaRutaDTO fila : rutas) {
                filas.add(Arrays.<Object>asList(fila.getCategoriaGeneral(), fila.getCategoriaEspecifica(),
                        fila.getSubtipo(), fila.getRutaCompleta(), fila.getFrecuencia(),
                        FormatoNumeros.porcentajeDosDecimales(fila.getPorcentaje())));
            }
        }
        return new SeccionTabla("RUTAS COMPLETAS DE MOTIVOS", Arrays.asList("categoria_general",
                "categoria_especifica", "subtipo", "ruta_completa", "Frecuencia", "% del Total"), filas);
    }

    private SeccionTabla seccionSubcategorias(ResultadoAnalisis resultado) {
        List<List<Object>> filas = new ArrayList<>();
        for (FilaSubcategoriaDTO fila : vistasReporte.vistaSubcategorias(resultado)) {
            filas.add(Arrays.<Object>asList(fila.getTipo(), fila.getSubcategoria(),
                    FormatoNumeros.miles(fila.getFrecuencia()), FormatoNumeros.porcentaje(fila.getPorcentaje()),
                    fila.getPrioridad().getEtiqueta()));
        }
        return new SeccionTabla("ANÁLISIS DE SUBCATEGORÍAS",
                Arrays.asList("Tipo", "Subcategoría", "Frecuencia", "% Total", "Prioridad"), filas);
    }

    // =============== ESCRITURA POI ===============

    private void escribirTabla(Sheet sheet, int filaInicial, List<String> encabezados,
                               List<List<Object>> filas, CellStyle estiloEncabezado) {
        Row headerRow = sheet.createRow(filaInicial);
        for (int i = 0; i < encabezados.size(); i++) {
            Cell cell = headerRow.createCell(i);
            cell.setCellValue(encabezados.get(i));
            cell.setCellStyle(estiloEncabezado);
        }

        for (int r = 0; r < filas.size(); r++) {
            Row row = sheet.createRow(filaInicial + 1 + r);
            List<Object> fila = filas.get(r);
            for (int c = 0; c < fila.size(); c++) {
                setCellValue(row.createCell(c), fila.get(c));
            }
        }
    }

    private CellStyle crearEstiloEncabezado(Workbook workbook) {
        CellStyle headerStyle = workbook.createCellStyle();
        Font font = workbook.createFont();
        font.setBold(true);
        headerStyle.setFont(font);
        return headerStyle;
    }

    private void setCellValue(Cell cell, Object valor) {
        if (valor == null) {
            cell.setCellValue("");
        } else if (valor instanceof Number) {
            cell.setCellValue(((Number) valor).doubleValue());
        } else {
            cell.setCellValue(String.valueOf(valor));
        }
    }

    /**
     * Ancho de columna según el texto más largo. Se evita autoSizeColumn
     * porque depende de las fuentes AWT del sistema.
     */
    private void autoSizeColumns(Sheet sheet, int maxColumns) {
        int[] anchos = new int[maxColumns];
        for (Row row : sheet) {
            for (int c = 0; c < maxColumns; c++) {
                Cell cell = row.getCell(c);
                if (cell != null && cell.getCellType() == CellType.STRING) {
                    anchos[c] = Math.max(anchos[c], cell.getStringCellValue().length());
                }
            }
        }
        for (int c = 0; c < maxColumns; c++) {
            int caracteres = Math.min(Math.max(anchos[c], ANCHO_MINIMO), ANCHO_MAXIMO);
            sheet.setColumnWidth(c, (caracteres + 2) * 256);
        }
    }

    /** Título, encabezados y filas de una sección; filas null = sección sin contenido */
    private static final class SeccionTabla {
        private final String titulo;
        private final List<String> encabezados;
        private final List<List<Object>> filas;

        private SeccionTabla(String titulo, List<String> encabezados, List<List<Object>> filas) {
            this.titulo = titulo;
            this.encabezados = encabezados;
            this.filas = filas;
        }
    }
}
