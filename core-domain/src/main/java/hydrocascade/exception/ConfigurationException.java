package hydrocascade.exception;

/**
 * Configuración inválida de la cascada (topología, curvas, zonas, tránsitos).
 * <p>
 * Es fatal: se lanza siempre antes de mutar ningún estado, por lo que la
 * simulación nunca llega a arrancar.
 */
public class ConfigurationException extends CascadeException {

    private final String entity;

    public ConfigurationException(String entity, String message) {
        super("[" + entity + "] " + message);
        this.entity = entity;
    }

    /**
     * Identificador de la entidad defectuosa (embalse, enlace o bloque de configuración).
     */
    public String getEntity() {
        return entity;
    }
}
