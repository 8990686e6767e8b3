package org.analisis_llamadas.service;

import lombok.extern.slf4j.Slf4j;
import org.analisis_llamadas.component.agregador.AgregadorFilas;
import org.analisis_llamadas.component.agregador.CalculadorDesgloseInstalador;
import org.analisis_llamadas.config.AnalisisProperties;
import org.analisis_llamadas.domain.ClavesAnalisis;
import org.analisis_llamadas.dto.FiltroFechasDTO;
import org.analisis_llamadas.enums.EtapaAnalisis;
import org.analisis_llamadas.exception.AnalisisException;
import org.analisis_llamadas.exception.SinCategoriasException;
import org.analisis_llamadas.model.AnalisisDetallado;
import org.analisis_llamadas.model.ContadorFrecuencias;
import org.analisis_llamadas.model.DesgloseInstalador;
import org.analisis_llamadas.model.ResultadoAnalisis;
import org.analisis_llamadas.model.ResultadoArchivo;
import org.analisis_llamadas.model.RutaCombinada;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Análisis de categorías sobre varios archivos.
 *
 * Los archivos se procesan uno a uno en el orden recibido. Los conteos se
 * suman clave a clave y las listas de detalle se concatenan en ese orden.
 * El desglose por instalador se recalcula sobre las rutas fusionadas para que
 * los porcentajes de cada agente sumen 100 en el total. El fallo de un archivo no afecta a los demás.
 *
 * @author Sistema Análisis de Llamadas
 */
@Slf4j
@Service
public class AnalisisCategoriasService {

    private static final String PREFIJO_ARCHIVO_BLOQUEO = "~$";
    private static final List<String> PATRONES_POR_DEFECTO = Collections.unmodifiableList(
            Arrays.asList("*.xlsx", "*.xls"));

    // =============== DEPENDENCIAS ===============

    @Autowired
    private AgregadorFilas agregadorFilas;

    @Autowired
    private CalculadorDesgloseInstalador calculadorDesglose;

    @Autowired
    private AnalisisProperties properties;

    // =============== API PRINCIPAL ===============

    /**
     * Analiza los archivos y fusiona sus resultados.
     *
     * @param archivos Archivos a procesar, en orden
     * @param filtro Rango de fechas (se valida antes de leer cualquier archivo)
     * @return Resultado combinado de todos los archivos
     */
    public ResultadoAnalisis analizarArchivos(List<Path> archivos, FiltroFechasDTO filtro) {
        FiltroFechasDTO filtroEfectivo = filtro != null ? filtro : FiltroFechasDTO.sinFiltro();
        filtroEfectivo.validar();

        log.info("=== ANÁLISIS INICIADO ===");
        log.info("Archivos: {}, Período: {}", archivos.size(), filtroEfectivo.describirPeriodo());

        ContadorFrecuencias frecuenciasTotales = new ContadorFrecuencias();
        AnalisisDetallado detalladoTotal = AnalisisDetallado.vacio();
        List<ResultadoArchivo> resultadosPorArchivo = new ArrayList<>(archivos.size());
        long totalFilas = 0;

        for (Path archivo : archivos) {
            ResultadoArchivo resultado = agregadorFilas.analizarArchivo(archivo, filtroEfectivo);
            resultadosPorArchivo.add(resultado);

            frecuenciasTotales.fusionar(resultado.getFrecuenciasGenerales());
            detalladoTotal.fusionar(resultado.getAnalisisDetallado());
            totalFilas += resultado.getFilasProcesadas();
        }

        if (archivos.size() > 1) {
            recalcularDesgloseInstalador(detalladoTotal);
        }

        long conError = resultadosPorArchivo.stream().filter(ResultadoArchivo::isConError).count();
        log.info("=== ANÁLISIS COMPLETADO: {} filas, {} categorías, {} archivo(s) con error ===",
                totalFilas, frecuenciasTotales.size(), conError);

        return new ResultadoAnalisis(frecuenciasTotales, totalFilas, detalladoTotal, archivos.size(),
                filtroEfectivo, Collections.unmodifiableList(resultadosPorArchivo));
    }

    /**
     * Igual que {@link #analizarArchivos} pero falla si ningún archivo aportó
     * categorías.
     *
     * @throws SinCategoriasException Si no se extrajo ninguna categoría
     */
    public ResultadoAnalisis analizarArchivosConCategorias(List<Path> archivos, FiltroFechasDTO filtro) {
        ResultadoAnalisis resultado = analizarArchivos(archivos, filtro);
        if (!resultado.tieneCategorias()) {
            throw new SinCategoriasException(resultado.getArchivosProcesados(), resultado.getTotalFilas());
        }
        return resultado;
    }

    /**
     * Sustituye los desgloses concatenados de cada archivo por uno calculado
     * sobre todas las rutas. Sólo se hace si algún archivo identificó la
     * columna de instalador; las rutas de archivos sin esa columna llevan
     * agente "Sin asignar" y quedan fuera del cálculo.
     */
    private void recalcularDesgloseInstalador(AnalisisDetallado detallado) {
        if (!detallado.contiene(ClavesAnalisis.AGENTE_INSTALADOR_DETALLE)) {
            return;
        }

        List<RutaCombinada> rutas = detallado.getRegistros(
                ClavesAnalisis.CATEGORIA_COMBINADA_DETALLE, RutaCombinada.class);
        List<DesgloseInstalador> desglose = calculadorDesglose.calcular(rutas);
        detallado.agregarRegistros(ClavesAnalisis.AGENTE_INSTALADOR_DETALLE, desglose);
        log.debug("Desglose por instalador recalculado: {} registros", desglose.size());
    }

    // =============== BÚSQUEDA DE ARCHIVOS ===============

    /**
     * Busca archivos en el directorio de resultados configurado.
     */
    public List<Path> buscarArchivos(String patron) {
        return buscarArchivos(Paths.get(properties.getDirectorioResultados()), patron);
    }

    /**
     * Busca archivos por patrón glob dentro de un directorio. Sin patrón se
     * buscan *.xlsx y *.xls. Los archivos de bloqueo de Office (~$) se
     * descartan y el resultado se ordena por nombre.
     *
     * @throws AnalisisException Si el directorio no existe o no puede listarse
     */
    public List<Path> buscarArchivos(Path directorio, String patron) {
        if (!Files.isDirectory(directorio)) {
            throw new AnalisisException("El directorio " + directorio + " no existe", EtapaAnalisis.VALIDACION);
        }

        List<String> patrones = patron != null && !patron.trim().isEmpty()
                ? Collections.singletonList(patron.trim()) : PATRONES_POR_DEFECTO;

        Set<Path> encontrados = new LinkedHashSet<>();
        for (String glob : patrones) {
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(directorio, glob)) {
                for (Path archivo : stream) {
                    if (Files.isRegularFile(archivo)
                            && !archivo.getFileName().toString().startsWith(PREFIJO_ARCHIVO_BLOQUEO)) {
                        encontrados.add(archivo);
                    }
                }
            } catch (IOException e) {
                throw new AnalisisException("No se pudo listar el directorio: " + e.getMessage(),
                        EtapaAnalisis.VALIDACION, directorio.toString(), e);
            }
        }

        List<Path> archivos = new ArrayList<>(encontrados);
        archivos.sort(Comparator.comparing(Path::toString));
        log.info("Se encontraron {} archivos en {}", archivos.size(), directorio);
        return archivos;
    }
}
