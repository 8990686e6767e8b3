package org.analisis_llamadas.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Conteo de frecuencias por etiqueta que conserva el orden de primera aparición.
 *
 * Los conteos sólo crecen. El ranking ordena por frecuencia descendente y
 * desempata por orden de inserción.
 */
public class ContadorFrecuencias {

    private final LinkedHashMap<String, Long> conteos = new LinkedHashMap<>();

    public ContadorFrecuencias() {}

    public ContadorFrecuencias(ContadorFrecuencias origen) {
        this.conteos.putAll(origen.conteos);
    }

    public void incrementar(String clave) {
        incrementar(clave, 1L);
    }

    public void incrementar(String clave, long cantidad) {
        if (clave == null) {
            throw new IllegalArgumentException("La clave no puede ser null");
        }
        if (cantidad < 0) {
            throw new IllegalArgumentException("Incremento negativo para '" + clave + "': " + cantidad);
        }
        conteos.merge(clave, cantidad, Long::sum);
    }

    /**
     * Suma clave a clave los conteos de otro contador.
     */
    public void fusionar(ContadorFrecuencias otro) {
        for (Map.Entry<String, Long> entrada : otro.conteos.entrySet()) {
            incrementar(entrada.getKey(), entrada.getValue());
        }
    }

    public long getFrecuencia(String clave) {
        Long valor = conteos.get(clave);
        return valor != null ? valor : 0L;
    }

    public long getTotal() {
        long total = 0;
        for (Long valor : conteos.values()) {
            total += valor;
        }
        return total;
    }

    public int size() {
        return conteos.size();
    }

    public boolean estaVacio() {
        return conteos.isEmpty();
    }

    public Set<String> getClaves() {
        return Collections.unmodifiableSet(conteos.keySet());
    }

    /**
     * Todas las etiquetas ordenadas de mayor a menor frecuencia.
     */
    public List<FrecuenciaCategoria> masComunes() {
        List<FrecuenciaCategoria> lista = new ArrayList<>(conteos.size());
        for (Map.Entry<String, Long> entrada : conteos.entrySet()) {
            lista.add(new FrecuenciaCategoria(entrada.getKey(), entrada.getValue()));
        }
        // List.sort es estable: los empates conservan el orden de inserción
        lista.sort(Comparator.comparingLong(FrecuenciaCategoria::getFrecuencia).reversed());
        return lista;
    }

    public List<FrecuenciaCategoria> masComunes(int limite) {
        List<FrecuenciaCategoria> todas = masComunes();
        return todas.size() > limite ? new ArrayList<>(todas.subList(0, limite)) : todas;
    }

    public Map<String, Long> comoMapa() {
        return Collections.unmodifiableMap(conteos);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContadorFrecuencias)) return false;
        return conteos.equals(((ContadorFrecuencias) o).conteos);
    }

    @Override
    public int hashCode() {
        return conteos.hashCode();
    }

    @Override
    public String toString() {
        return "ContadorFrecuencias" + conteos;
    }
}
