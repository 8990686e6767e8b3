package org.analisis_llamadas.component.lector;

import com.opencsv.CSVParser;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;
import lombok.extern.slf4j.Slf4j;
import org.analisis_llamadas.enums.EtapaAnalisis;
import org.analisis_llamadas.exception.AnalisisException;
import org.analisis_llamadas.model.TablaDatos;
import org.apache.poi.EmptyFileException;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lee la primera hoja de un libro Excel (.xlsx / .xls) o un archivo CSV como
 * {@link TablaDatos}. La primera fila define los nombres de columna.
 */
@Slf4j
@Component
public class LectorExcel {

    private static final String PREFIJO_SIN_NOMBRE = "Unnamed: ";

    /**
     * Lee un archivo según su extensión.
     *
     * @param archivo Ruta del archivo
     * @return Tabla con los datos de la primera hoja
     * @throws AnalisisException Si el archivo no existe o no puede leerse
     */
    public TablaDatos leer(Path archivo) {
        String nombre = archivo.getFileName().toString();

        if (!Files.isRegularFile(archivo)) {
            throw new AnalisisException("El archivo no existe", EtapaAnalisis.LECTURA, nombre);
        }

        try {
            if (nombre.toLowerCase(Locale.ROOT).endsWith(".csv")) {
                return leerCsv(archivo, nombre);
            }
            return leerLibro(archivo, nombre);
        } catch (IOException | CsvException e) {
            throw new AnalisisException("No se pudo leer el archivo: " + e.getMessage(),
                    EtapaAnalisis.LECTURA, nombre, e);
        } catch (EmptyFileException | UnsupportedFileFormatException e) {
            throw new AnalisisException("Formato de archivo no reconocido: " + e.getMessage(),
                    EtapaAnalisis.LECTURA, nombre, e);
        }
    }

    // =============== EXCEL ===============

    private TablaDatos leerLibro(Path archivo, String nombre) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(archivo.toFile(), null, true)) {
            if (workbook.getNumberOfSheets() == 0) {
                log.warn("El libro {} no tiene hojas", nombre);
                return TablaDatos.vacia(nombre);
            }

            Sheet sheet = workbook.getSheetAt(0);
            Row encabezado = sheet.getRow(sheet.getFirstRowNum());
            if (encabezado == null || sheet.getPhysicalNumberOfRows() == 0) {
                return TablaDatos.vacia(nombre);
            }

            int primeraFila = encabezado.getRowNum();
            int ancho = calcularAncho(sheet, primeraFila);

            // DataFormatter no es thread-safe: uno por lectura
            DataFormatter formateador = new DataFormatter(Locale.ROOT);
            List<String> nombresCrudos = new ArrayList<>(ancho);
            for (int c = 0; c < ancho; c++) {
                Cell celda = encabezado.getCell(c);
                nombresCrudos.add(celda == null ? null : formateador.formatCellValue(celda).trim());
            }
            List<String> columnas = nombrarColumnas(nombresCrudos);

            List<List<Object>> filas = new ArrayList<>();
            int ultimaConDatos = -1;
            for (int r = primeraFila + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                List<Object> fila = new ArrayList<>(ancho);
                boolean tieneDatos = false;
                for (int c = 0; c < ancho; c++) {
                    Object valor = row == null ? null : valorCelda(row.getCell(c));
                    tieneDatos |= valor != null;
                    fila.add(valor);
                }
                filas.add(fila);
                if (tieneDatos) {
                    ultimaConDatos = filas.size() - 1;
                }
            }

            // Las filas vacías al final de la hoja no son datos
            List<List<Object>> filasDatos = new ArrayList<>(filas.subList(0, ultimaConDatos + 1));

            log.debug("Hoja '{}' de {}: {} filas, {} columnas", sheet.getSheetName(), nombre,
                    filasDatos.size(), columnas.size());
            return new TablaDatos(nombre, columnas, filasDatos);
        }
    }

    private int calcularAncho(Sheet sheet, int primeraFila) {
        int ancho = 0;
        for (int r = primeraFila; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row != null && row.getLastCellNum() > ancho) {
                ancho = row.getLastCellNum();
            }
        }
        return ancho;
    }

    private Object valorCelda(Cell celda) {
        if (celda == null) {
            return null;
        }

        CellType tipo = celda.getCellType();
        if (tipo == CellType.FORMULA) {
            tipo = celda.getCachedFormulaResultType();
        }

        switch (tipo) {
            case STRING:
                String texto = celda.getStringCellValue();
                return texto == null || texto.trim().isEmpty() ? null : texto;
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(celda)) {
                    return celda.getLocalDateTimeCellValue();
                }
                return numero(celda.getNumericCellValue());
            case BOOLEAN:
                return celda.getBooleanCellValue();
            case BLANK:
            case ERROR:
            default:
                return null;
        }
    }

    /** Los enteros se conservan como Long para que "7" no se convierta en "7.0" */
    private Object numero(double valor) {
        if (valor == Math.rint(valor) && !Double.isInfinite(valor) && Math.abs(valor) < 1e15) {
            return (long) valor;
        }
        return valor;
    }

    // =============== CSV ===============

    private TablaDatos leerCsv(Path archivo, String nombre) throws IOException, CsvException {
        char separador = detectarSeparador(archivo);
        CSVParser parser = new CSVParserBuilder().withSeparator(separador).build();

        List<String[]> lineas;
        try (Reader reader = Files.newBufferedReader(archivo, StandardCharsets.UTF_8);
             CSVReader csvReader = new CSVReaderBuilder(reader).withCSVParser(parser).build()) {
            lineas = csvReader.readAll();
        }

        if (lineas.isEmpty()) {
            return TablaDatos.vacia(nombre);
        }

        String[] encabezado = lineas.get(0);
        int ancho = encabezado.length;
        for (String[] linea : lineas) {
            ancho = Math.max(ancho, linea.length);
        }

        List<String> nombresCrudos = new ArrayList<>(ancho);
        for (int c = 0; c < ancho; c++) {
            String valor = c < encabezado.length ? quitarBom(encabezado[c], c) : null;
            nombresCrudos.add(valor == null ? null : valor.trim());
        }
        List<String> columnas = nombrarColumnas(nombresCrudos);

        List<List<Object>> filas = new ArrayList<>();
        for (int i = 1; i < lineas.size(); i++) {
            String[] linea = lineas.get(i);
            if (esLineaVacia(linea)) {
                continue;
            }
            List<Object> fila = new ArrayList<>(ancho);
            for (int c = 0; c < ancho; c++) {
                String valor = c < linea.length ? linea[c] : null;
                fila.add(valor == null || valor.trim().isEmpty() ? null : valor);
            }
            filas.add(fila);
        }

        log.debug("CSV {}: {} filas, {} columnas (separador '{}')", nombre, filas.size(), columnas.size(), separador);
        return new TablaDatos(nombre, columnas, filas);
    }

    private char detectarSeparador(Path archivo) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(archivo, StandardCharsets.UTF_8)) {
            String primeraLinea = reader.readLine();
            if (primeraLinea == null) {
                return ',';
            }
            long comas = primeraLinea.chars().filter(ch -> ch == ',').count();
            long puntoYComa = primeraLinea.chars().filter(ch -> ch == ';').count();
            return puntoYComa > comas ? ';' : ',';
        }
    }

    private String quitarBom(String valor, int columna) {
        if (columna == 0 && valor != null && valor.startsWith("\uFEFF")) {
            return valor.substring(1);
        }
        return valor;
    }

    private boolean esLineaVacia(String[] linea) {
        for (String valor : linea) {
            if (valor != null && !valor.trim().isEmpty()) {
                return false;
            }
        }
        return true;
    }

    // =============== ENCABEZADOS ===============

    /**
     * Asigna nombres a columnas sin encabezado ("Unnamed: 3") y desambigua
     * nombres repetidos con sufijo ("motivo", "motivo.1").
     */
    List<String> nombrarColumnas(List<String> nombresCrudos) {
        List<String> columnas = new ArrayList<>(nombresCrudos.size());
        Map<String, Integer> repeticiones = new HashMap<>();

        for (int i = 0; i < nombresCrudos.size(); i++) {
            String nombre = nombresCrudos.get(i);
            if (nombre == null || nombre.isEmpty()) {
                nombre = PREFIJO_SIN_NOMBRE + i;
            }

            String unico = nombre;
            while (columnas.contains(unico)) {
                int n = repeticiones.merge(nombre, 1, Integer::sum);
                unico = nombre + "." + n;
            }
            columnas.add(unico);
        }

        return Collections.unmodifiableList(columnas);
    }
}
