module io.github.cyfko.proplogic.core {
    requires java.logging;

    exports io.github.cyfko.proplogic.core;
    exports io.github.cyfko.proplogic.core.analysis;
    exports io.github.cyfko.proplogic.core.api;
    exports io.github.cyfko.proplogic.core.cache;
    exports io.github.cyfko.proplogic.core.config;
    exports io.github.cyfko.proplogic.core.evaluation;
    exports io.github.cyfko.proplogic.core.exception;
    exports io.github.cyfko.proplogic.core.impl;
    exports io.github.cyfko.proplogic.core.model;
    exports io.github.cyfko.proplogic.core.parsing;
    exports io.github.cyfko.proplogic.core.table;
    exports io.github.cyfko.proplogic.core.utils;
}
