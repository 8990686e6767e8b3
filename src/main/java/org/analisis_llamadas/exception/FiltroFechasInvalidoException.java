package org.analisis_llamadas.exception;

import org.analisis_llamadas.enums.EtapaAnalisis;

/**
 * Fecha de filtro con formato inválido o rango invertido.
 */
public class FiltroFechasInvalidoException extends AnalisisException {

    public FiltroFechasInvalidoException(String detalle) {
        super(detalle, EtapaAnalisis.VALIDACION);
    }

    public FiltroFechasInvalidoException(String detalle, Throwable cause) {
        super(detalle, EtapaAnalisis.VALIDACION, null, cause);
    }
}
