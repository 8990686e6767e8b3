package org.analisis_llamadas.component.reporte;

import org.analisis_llamadas.component.agregador.CalculadorDesgloseInstalador;
import org.analisis_llamadas.domain.ClavesAnalisis;
import org.analisis_llamadas.dto.FiltroFechasDTO;
import org.analisis_llamadas.enums.EstadoFiltroFecha;
import org.analisis_llamadas.model.AnalisisDetallado;
import org.analisis_llamadas.model.ContadorFrecuencias;
import org.analisis_llamadas.model.ResultadoAnalisis;
import org.analisis_llamadas.model.ResultadoArchivo;
import org.analisis_llamadas.model.RutaCombinada;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Resultado fijo de 20 llamadas: Red 12, Billing 6, Otros 1, Varios 1.
 */
final class ResultadosPrueba {

    private ResultadosPrueba() {}

    static ResultadoAnalisis completo() {
        ContadorFrecuencias generales = contador("Red", 12L, "Billing", 6L, "Otros", 1L, "Varios", 1L);

        List<RutaCombinada> rutas = Arrays.asList(
                RutaCombinada.crear("Red", "Lenta", null, "Ana"),
                RutaCombinada.crear("Red", "Caida", null, "Ana"),
                RutaCombinada.crear("Red", "Lenta", null, "Ana"),
                RutaCombinada.crear("Billing", null, "Factura", "Sin asignar"));
        ContadorFrecuencias combinada = new ContadorFrecuencias();
        for (RutaCombinada ruta : rutas) {
            combinada.incrementar(ruta.getRutaCompleta());
        }

        AnalisisDetallado detallado = AnalisisDetallado.vacio();
        detallado.agregarFrecuencias("categoria_especifica", contador("Lenta", 8L, "Caida", 1L));
        detallado.agregarFrecuencias(ClavesAnalisis.CATEGORIA_COMBINADA, combinada);
        detallado.agregarRegistros(ClavesAnalisis.CATEGORIA_COMBINADA_DETALLE, rutas);
        detallado.agregarRegistros(ClavesAnalisis.AGENTE_INSTALADOR_DETALLE,
                new CalculadorDesgloseInstalador().calcular(rutas));

        List<ResultadoArchivo> porArchivo = Arrays.asList(
                new ResultadoArchivo("enero.xlsx", generales, 20L, detallado, EstadoFiltroFecha.NO_CONFIGURADO, false),
                ResultadoArchivo.conError("roto.xlsx"));

        return new ResultadoAnalisis(generales, 20L, detallado, 2, FiltroFechasDTO.sinFiltro(), porArchivo);
    }

    static ResultadoAnalisis sinRutas() {
        AnalisisDetallado detallado = AnalisisDetallado.vacio();
        detallado.agregarFrecuencias("subtipo_categoria", contador("Intermitente", 3L));
        return new ResultadoAnalisis(contador("Red", 10L), 10L, detallado, 1);
    }

    /** Beto 3 llamadas (Red 2, Billing 1), Carla 3 (Billing), Ana 2 (Red) */
    static ResultadoAnalisis variosAgentes() {
        List<RutaCombinada> rutas = Arrays.asList(
                RutaCombinada.crear("Red", "Lenta", null, "Beto"),
                RutaCombinada.crear("Red", "Lenta", null, "Beto"),
                RutaCombinada.crear("Billing", null, null, "Beto"),
                RutaCombinada.crear("Red", "Caida", null, "Ana"),
                RutaCombinada.crear("Red", "Lenta", null, "Ana"),
                RutaCombinada.crear("Billing", null, "Factura", "Carla"),
                RutaCombinada.crear("Billing", null, "Factura", "Carla"),
                RutaCombinada.crear("Billing", null, "Factura", "Carla"));

        AnalisisDetallado detallado = AnalisisDetallado.vacio();
        detallado.agregarRegistros(ClavesAnalisis.CATEGORIA_COMBINADA_DETALLE, rutas);
        detallado.agregarRegistros(ClavesAnalisis.AGENTE_INSTALADOR_DETALLE,
                new CalculadorDesgloseInstalador().calcular(rutas));
        return new ResultadoAnalisis(contador("Red", 4L, "Billing", 4L), 8L, detallado, 1);
    }

    static ResultadoAnalisis vacio() {
        return new ResultadoAnalisis(new ContadorFrecuencias(), 0L, AnalisisDetallado.vacio(), 1,
                FiltroFechasDTO.sinFiltro(), Collections.<ResultadoArchivo>emptyList());
    }

    private static ContadorFrecuencias contador(Object... pares) {
        ContadorFrecuencias contador = new ContadorFrecuencias();
        for (int i = 0; i < pares.length; i += 2) {
            contador.incrementar((String) pares[i], (Long) pares[i + 1]);
        }
        return contador;
    }
}
