package org.analisis_llamadas.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@AllArgsConstructor
@NoArgsConstructor
@Data
@Builder
public class FilaAgenteCategoriaDTO {
    private String agenteInstalador;
    private String categoriaGeneral;
    private long llamadas;
}
