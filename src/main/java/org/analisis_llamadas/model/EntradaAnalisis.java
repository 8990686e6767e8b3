package org.analisis_llamadas.model;

import org.analisis_llamadas.enums.TipoEntrada;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Valor de una clave del análisis detallado: un conteo de frecuencias o una
 * lista de registros. La fusión de dos entradas requiere que tengan la misma forma.
 */
public abstract class EntradaAnalisis {

    private EntradaAnalisis() {}

    public abstract TipoEntrada getTipo();

    /** Copia independiente, apta para acumular sin modificar el origen */
    abstract EntradaAnalisis copiar();

    /** Acumula otra entrada de la misma forma sobre ésta */
    abstract void acumular(EntradaAnalisis otra);

    public abstract boolean estaVacia();

    public static EntradaAnalisis frecuencias(ContadorFrecuencias contador) {
        return new Frecuencias(contador);
    }

    public static EntradaAnalisis registros(List<?> registros) {
        return new Registros(registros);
    }

    public boolean esFrecuencias() {
        return getTipo() == TipoEntrada.FRECUENCIAS;
    }

    public boolean esRegistros() {
        return getTipo() == TipoEntrada.REGISTROS;
    }

    public ContadorFrecuencias getFrecuencias() {
        if (!esFrecuencias()) {
            throw new IllegalStateException("La entrada no es un conteo de frecuencias: " + getTipo());
        }
        return ((Frecuencias) this).contador;
    }

    /**
     * Registros de la entrada, verificando el tipo de cada elemento.
     */
    public <T> List<T> getRegistros(Class<T> tipo) {
        if (!esRegistros()) {
            throw new IllegalStateException("La entrada no es una lista de registros: " + getTipo());
        }
        List<Object> registros = ((Registros) this).registros;
        List<T> resultado = new ArrayList<>(registros.size());
        for (Object registro : registros) {
            resultado.add(tipo.cast(registro));
        }
        return Collections.unmodifiableList(resultado);
    }

    // =============== VARIANTES ===============

    private static final class Frecuencias extends EntradaAnalisis {
        private final ContadorFrecuencias contador;

        private Frecuencias(ContadorFrecuencias contador) {
            this.contador = contador;
        }

        @Override
        public TipoEntrada getTipo() {
            return TipoEntrada.FRECUENCIAS;
        }

        @Override
        EntradaAnalisis copiar() {
            return new Frecuencias(new ContadorFrecuencias(contador));
        }

        @Override
        void acumular(EntradaAnalisis otra) {
            contador.fusionar(otra.getFrecuencias());
        }

        @Override
        public boolean estaVacia() {
            return contador.estaVacio();
        }

        @Override
        public String toString() {
            return "Frecuencias" + contador.comoMapa();
        }
    }

    private static final class Registros extends EntradaAnalisis {
        private final List<Object> registros;

        private Registros(List<?> registros) {
            this.registros = new ArrayList<>(registros);
        }

        @Override
        public TipoEntrada getTipo() {
            return TipoEntrada.REGISTROS;
        }

        @Override
        EntradaAnalisis copiar() {
            return new Registros(registros);
        }

        @Override
        void acumular(EntradaAnalisis otra) {
            registros.addAll(((Registros) otra).registros);
        }

        @Override
        public boolean estaVacia() {
            return registros.isEmpty();
        }

        @Override
        public String toString() {
            return "Registros" + registros;
        }
    }
}
