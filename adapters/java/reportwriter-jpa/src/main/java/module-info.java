module io.github.cyfko.reportwriter.jpa {
    requires io.github.cyfko.reportwriter.core;
    requires jakarta.persistence;
    requires java.logging;

    exports io.github.cyfko.reportwriter.jpa;
}
