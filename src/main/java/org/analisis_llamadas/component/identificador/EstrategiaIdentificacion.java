package org.analisis_llamadas.component.identificador;

import org.analisis_llamadas.model.TablaDatos;

import java.util.Optional;

/**
 * Estrategia para identificar una columna de una tabla.
 *
 * Las estrategias se evalúan en orden dentro de una {@link CadenaIdentificacion};
 * una estrategia sin resultado devuelve vacío y nunca lanza excepción.
 */
public interface EstrategiaIdentificacion {

    /**
     * @param tabla Tabla a inspeccionar
     * @return Nombre original de la columna identificada, o vacío
     */
    Optional<String> identificar(TablaDatos tabla);

    /**
     * Nombre descriptivo de la estrategia para logging.
     */
    String getNombre();
}
