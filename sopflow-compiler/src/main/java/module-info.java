module dev.mars.sopflow.compiler {
    requires java.logging;
    requires transitive dev.mars.sopflow.core;

    requires com.fasterxml.jackson.databind;
    requires org.yaml.snakeyaml;

    exports dev.mars.sopflow.mapping;
    exports dev.mars.sopflow.validation;
    exports dev.mars.sopflow.compiler;
    exports dev.mars.sopflow.markup;
}
