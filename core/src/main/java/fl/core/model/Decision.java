package fl.core.model;

public enum Decision {
    ALLOW,
    REJECT
}
