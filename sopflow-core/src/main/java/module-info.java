module dev.mars.sopflow.core {
    requires java.logging;
    requires transitive com.fasterxml.jackson.databind;
    requires com.fasterxml.jackson.annotation;

    exports dev.mars.sopflow.core;
    exports dev.mars.sopflow.core.exceptions;
    exports dev.mars.sopflow.graph;
    exports dev.mars.sopflow.config;

    opens dev.mars.sopflow.graph to com.fasterxml.jackson.databind;
}
