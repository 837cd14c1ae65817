package polyopt.polyhedral.schedule;

public enum NodeKind {
    DOMAIN, BAND, SEQUENCE, SET, FILTER, LEAF
}
