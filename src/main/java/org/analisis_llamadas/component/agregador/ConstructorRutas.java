package org.analisis_llamadas.component.agregador;

import lombok.extern.slf4j.Slf4j;
import org.analisis_llamadas.domain.ColumnasConocidas;
import org.analisis_llamadas.model.ContadorFrecuencias;
import org.analisis_llamadas.model.RutaCombinada;
import org.analisis_llamadas.model.TablaDatos;
import org.analisis_llamadas.utils.ValoresCelda;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Construye la ruta "general | específica | subtipo" de cada llamada.
 *
 * Cada fila cuenta como una única llamada: los valores nunca se separan por
 * delimitadores. De las columnas de categoría específica y de subtipo se toma
 * el primer valor presente, en orden de columna. Sólo se registran rutas con
 * al menos una parte además de la categoría general.
 */
@Slf4j
@Component
public class ConstructorRutas {

    public RutasConstruidas construir(TablaDatos tabla, String columnaInstalador) {
        ContadorFrecuencias frecuencias = new ContadorFrecuencias();
        List<RutaCombinada> detalle = new ArrayList<>();

        String columnaGeneral = null;
        List<String> columnasEspecificas = new ArrayList<>();
        List<String> columnasSubtipo = new ArrayList<>();

        for (String columna : tabla.getColumnas()) {
            String minusculas = columna.toLowerCase(Locale.ROOT);
            if (minusculas.equals(ColumnasConocidas.CATEGORIA_GENERAL)) {
                if (columnaGeneral == null) {
                    columnaGeneral = columna;
                }
            } else if (minusculas.contains(ColumnasConocidas.FRAGMENTO_CATEGORIA_ESPECIFICA)) {
                columnasEspecificas.add(columna);
            } else if (minusculas.contains(ColumnasConocidas.FRAGMENTO_SUBTIPO)) {
                columnasSubtipo.add(columna);
            }
        }

        if (columnaGeneral == null) {
            log.debug("{}: sin columna '{}', no se construyen rutas", tabla.getNombre(), ColumnasConocidas.CATEGORIA_GENERAL);
            return new RutasConstruidas(frecuencias, detalle);
        }

        for (int fila = 0; fila < tabla.getNumeroFilas(); fila++) {
            Object valorGeneral = tabla.getValor(fila, columnaGeneral);
            if (valorGeneral == null) {
                continue;
            }

            String general = ValoresCelda.aTexto(valorGeneral);
            String especifica = primerValorPresente(tabla, fila, columnasEspecificas);
            String subtipo = primerValorPresente(tabla, fila, columnasSubtipo);

            if (especifica == null && subtipo == null) {
                continue;
            }

            RutaCombinada ruta = RutaCombinada.crear(general, especifica, subtipo,
                    resolverAgente(tabla, fila, columnaInstalador));
            frecuencias.incrementar(ruta.getRutaCompleta());
            detalle.add(ruta);
        }

        log.debug("{}: {} rutas combinadas ({} distintas)", tabla.getNombre(), detalle.size(), frecuencias.size());
        return new RutasConstruidas(frecuencias, detalle);
    }

    private String primerValorPresente(TablaDatos tabla, int fila, List<String> columnas) {
        for (String columna : columnas) {
            Object valor = tabla.getValor(fila, columna);
            if (valor != null) {
                return ValoresCelda.aTexto(valor);
            }
        }
        return null;
    }

    private String resolverAgente(TablaDatos tabla, int fila, String columnaInstalador) {
        if (columnaInstalador == null || !tabla.tieneColumna(columnaInstalador)) {
            return ColumnasConocidas.SIN_ASIGNAR;
        }
        Object valor = tabla.getValor(fila, columnaInstalador);
        if (valor == null) {
            return ColumnasConocidas.SIN_ASIGNAR;
        }
        String agente = ValoresCelda.aTexto(valor);
        return agente.isEmpty() ? ColumnasConocidas.SIN_ASIGNAR : agente;
    }
}
