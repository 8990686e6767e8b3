package org.analisis_llamadas.component.agregador;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.analisis_llamadas.component.identificador.IdentificadorColumnas;
import org.analisis_llamadas.component.lector.LectorExcel;
import org.analisis_llamadas.domain.ClavesAnalisis;
import org.analisis_llamadas.domain.ColumnasConocidas;
import org.analisis_llamadas.dto.FiltroFechasDTO;
import org.analisis_llamadas.enums.EstadoFiltroFecha;
import org.analisis_llamadas.enums.EtapaAnalisis;
import org.analisis_llamadas.exception.AnalisisException;
import org.analisis_llamadas.model.AnalisisDetallado;
import org.analisis_llamadas.model.ContadorFrecuencias;
import org.analisis_llamadas.model.DesgloseInstalador;
import org.analisis_llamadas.model.ResultadoArchivo;
import org.analisis_llamadas.model.TablaDatos;
import org.analisis_llamadas.utils.NormalizadorColumnas;
import org.analisis_llamadas.utils.ValoresCelda;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Analiza las filas de un archivo: conteo de categorías generales, conteos por
 * columna de categoría específica, rutas combinadas y desglose por instalador.
 *
 * Cada fila es una llamada. Los valores de categoría se cuentan como literales
 * completos; "A, B" es una única categoría.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgregadorFilas {

    private final LectorExcel lectorExcel;
    private final IdentificadorColumnas identificadorColumnas;
    private final FiltradorFechas filtradorFechas;
    private final ConstructorRutas constructorRutas;
    private final CalculadorDesgloseInstalador calculadorDesglose;

    // =============== API PRINCIPAL ===============

    /**
     * Lee y analiza un archivo. Cualquier error queda acotado al archivo: se
     * registra y el archivo aporta un resultado vacío.
     *
     * @param archivo Ruta del archivo a analizar
     * @param filtro Rango de fechas (puede no estar configurado)
     * @return Resultado del archivo, marcado con error si falló
     */
    public ResultadoArchivo analizarArchivo(Path archivo, FiltroFechasDTO filtro) {
        String nombre = archivo.getFileName().toString();
        log.info("📄 Procesando archivo: {}", nombre);

        try {
            TablaDatos tabla = lectorExcel.leer(archivo);
            ResultadoArchivo resultado = analizarTabla(tabla, filtro);
            log.info("✅ {}: {} filas, {} categorías generales", nombre,
                    resultado.getFilasProcesadas(), resultado.getFrecuenciasGenerales().size());
            return resultado;

        } catch (AnalisisException e) {
            log.error("Error procesando archivo {} en etapa {}: {}", nombre,
                    e.getEtapa() != null ? e.getEtapa().getDescripcion() : "desconocida", e.getDetalle(), e);
            return ResultadoArchivo.conError(nombre);
        } catch (RuntimeException e) {
            log.error("Error inesperado procesando archivo {} en etapa {}: {}", nombre,
                    EtapaAnalisis.AGREGACION.getDescripcion(), e.getMessage(), e);
            return ResultadoArchivo.conError(nombre);
        }
    }

    /**
     * Analiza una tabla ya leída.
     */
    public ResultadoArchivo analizarTabla(TablaDatos tabla, FiltroFechasDTO filtro) {
        String nombre = tabla.getNombre();

        if (tabla.estaVacia()) {
            log.warn("⚠️ {}: archivo sin filas", nombre);
            return ResultadoArchivo.vacio(nombre, EstadoFiltroFecha.NO_CONFIGURADO);
        }

        // 1. Filtro de fechas
        ResultadoFiltro resultadoFiltro = filtradorFechas.aplicar(tabla, filtro);
        TablaDatos filtrada = resultadoFiltro.getTabla();
        EstadoFiltroFecha estado = resultadoFiltro.getEstado();

        if (filtrada.estaVacia()) {
            log.warn("⚠️ {}: ninguna fila dentro del rango de fechas", nombre);
            return ResultadoArchivo.vacio(nombre, estado);
        }

        long filas = filtrada.getNumeroFilas();

        // 2. Categoría general
        Optional<String> columnaCategoria = identificadorColumnas.identificarColumnaCategoria(filtrada);
        if (!columnaCategoria.isPresent()) {
            log.warn("⚠️ {}: sin columna de categoría, se informan {} filas sin categorías", nombre, filas);
            return ResultadoArchivo.sinCategorias(nombre, filas, estado);
        }

        ContadorFrecuencias generales = contarValores(filtrada, columnaCategoria.get());
        if (generales.estaVacio()) {
            log.warn("⚠️ {}: la columna '{}' no tiene valores", nombre, columnaCategoria.get());
            return ResultadoArchivo.sinCategorias(nombre, filas, estado);
        }

        AnalisisDetallado detallado = AnalisisDetallado.vacio();

        // 3. Columnas de categoría específica
        analizarColumnasEspecificas(filtrada, detallado);

        // 4. Rutas combinadas y desglose por instalador
        Optional<String> columnaInstalador = identificadorColumnas.identificarColumnaInstalador(filtrada);
        RutasConstruidas rutas = constructorRutas.construir(filtrada, columnaInstalador.orElse(null));

        if (!rutas.getDetalle().isEmpty()) {
            detallado.agregarFrecuencias(ClavesAnalisis.CATEGORIA_COMBINADA, rutas.getFrecuencias());
            detallado.agregarRegistros(ClavesAnalisis.CATEGORIA_COMBINADA_DETALLE, rutas.getDetalle());

            if (columnaInstalador.isPresent()) {
                List<DesgloseInstalador> desglose = calculadorDesglose.calcular(rutas.getDetalle());
                if (!desglose.isEmpty()) {
                    detallado.agregarRegistros(ClavesAnalisis.AGENTE_INSTALADOR_DETALLE, desglose);
                }
            }
        }

        return new ResultadoArchivo(nombre, generales, filas, detallado, estado, false);
    }

    // =============== AUXILIARES ===============

    private void analizarColumnasEspecificas(TablaDatos tabla, AnalisisDetallado detallado) {
        Set<String> procesadas = new LinkedHashSet<>();

        for (String candidata : ColumnasConocidas.COLUMNAS_CATEGORIA_ESPECIFICA) {
            for (String columna : NormalizadorColumnas.buscarColumnasCoincidentes(tabla.getColumnas(), candidata)) {
                if (!procesadas.add(columna)) {
                    continue;
                }
                ContadorFrecuencias contador = contarValores(tabla, columna);
                if (contador.estaVacio()) {
                    continue;
                }
                detallado.agregarFrecuencias(columna, contador);
                log.debug("{}: columna específica '{}' con {} valores distintos",
                        tabla.getNombre(), columna, contador.size());
            }
        }
    }

    private ContadorFrecuencias contarValores(TablaDatos tabla, String columna) {
        ContadorFrecuencias contador = new ContadorFrecuencias();
        for (Object valor : tabla.getValoresColumna(columna)) {
            if (valor == null) {
                continue;
            }
            String texto = ValoresCelda.aTexto(valor);
            if (!texto.isEmpty()) {
                contador.incrementar(texto);
            }
        }
        return contador;
    }
}
