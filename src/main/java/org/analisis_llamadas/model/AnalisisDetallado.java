package org.analisis_llamadas.model;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Conjunto de sub-análisis con nombre: conteos por columna y listas de detalle.
 * Conserva el orden en que se agregan las claves.
 */
@Slf4j
public class AnalisisDetallado {

    private final LinkedHashMap<String, EntradaAnalisis> entradas = new LinkedHashMap<>();

    public static AnalisisDetallado vacio() {
        return new AnalisisDetallado();
    }

    /** Copia independiente: modificarla no afecta a este análisis */
    public AnalisisDetallado copia() {
        AnalisisDetallado copia = new AnalisisDetallado();
        copia.fusionar(this);
        return copia;
    }

    public void agregarFrecuencias(String clave, ContadorFrecuencias contador) {
        entradas.put(clave, EntradaAnalisis.frecuencias(contador));
    }

    public void agregarRegistros(String clave, List<?> registros) {
        entradas.put(clave, EntradaAnalisis.registros(registros));
    }

    public boolean contiene(String clave) {
        return entradas.containsKey(clave);
    }

    public EntradaAnalisis get(String clave) {
        return entradas.get(clave);
    }

    public Optional<ContadorFrecuencias> getFrecuencias(String clave) {
        EntradaAnalisis entrada = entradas.get(clave);
        if (entrada == null || !entrada.esFrecuencias()) {
            return Optional.empty();
        }
        return Optional.of(entrada.getFrecuencias());
    }

    public <T> List<T> getRegistros(String clave, Class<T> tipo) {
        EntradaAnalisis entrada = entradas.get(clave);
        if (entrada == null || !entrada.esRegistros()) {
            return Collections.emptyList();
        }
        return entrada.getRegistros(tipo);
    }

    public Set<String> getClaves() {
        return Collections.unmodifiableSet(entradas.keySet());
    }

    public Map<String, EntradaAnalisis> getEntradas() {
        return Collections.unmodifiableMap(entradas);
    }

    public boolean estaVacio() {
        return entradas.isEmpty();
    }

    public int size() {
        return entradas.size();
    }

    /**
     * Acumula otro análisis sobre éste: los conteos se suman clave a clave y
     * las listas se concatenan en orden. Una clave que cambia de forma entre
     * archivos no se fusiona y se registra como advertencia.
     */
    public void fusionar(AnalisisDetallado otro) {
        for (Map.Entry<String, EntradaAnalisis> entrada : otro.entradas.entrySet()) {
            String clave = entrada.getKey();
            EntradaAnalisis nueva = entrada.getValue();
            EntradaAnalisis existente = entradas.get(clave);

            if (existente == null) {
                entradas.put(clave, nueva.copiar());
            } else if (existente.getTipo() == nueva.getTipo()) {
                existente.acumular(nueva);
            } else {
                log.warn("Clave '{}' con forma distinta entre archivos ({} vs {}): se ignora el aporte",
                        clave, existente.getTipo(), nueva.getTipo());
            }
        }
    }

    @Override
    public String toString() {
        return "AnalisisDetallado" + entradas;
    }
}
