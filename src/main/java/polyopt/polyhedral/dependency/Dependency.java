package polyopt.polyhedral.dependency;

public enum Dependency {
    FLOW,   // read after write
    ANTI,   // write after read
    OUTPUT  // write after write
}
