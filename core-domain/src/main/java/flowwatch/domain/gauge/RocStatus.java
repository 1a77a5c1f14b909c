package flowwatch.domain.gauge;

public enum RocStatus {
    OK,
    /**
     * No hay ninguna lectura con caudal dentro de la tolerancia del desfase objetivo.
     */
    NO_EARLIER_READING,
    /**
     * La lectura de referencia tiene caudal cero, o tan cercano a cero que el porcentaje
     * no es finito; el porcentaje no está definido.
     */
    ZERO_BASELINE,
    /**
     * La lectura más reciente llegó con el marcador de dato ausente.
     */
    MISSING_LATEST_FLOW
}
