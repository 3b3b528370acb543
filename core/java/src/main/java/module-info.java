module io.github.cyfko.reportwriter.core {
    requires java.logging;

    exports io.github.cyfko.reportwriter.core;
    exports io.github.cyfko.reportwriter.core.api;
    exports io.github.cyfko.reportwriter.core.config;
    exports io.github.cyfko.reportwriter.core.engine;
    exports io.github.cyfko.reportwriter.core.exception;
    exports io.github.cyfko.reportwriter.core.model;
    exports io.github.cyfko.reportwriter.core.render;
    exports io.github.cyfko.reportwriter.core.spi;
    exports io.github.cyfko.reportwriter.core.utils;
}
