module io.github.cyfko.tgrep.core {
    requires java.logging;

    exports io.github.cyfko.tgrep.core;
    exports io.github.cyfko.tgrep.core.api;
    exports io.github.cyfko.tgrep.core.cache;
    exports io.github.cyfko.tgrep.core.config;
    exports io.github.cyfko.tgrep.core.exception;
    exports io.github.cyfko.tgrep.core.impl;
    exports io.github.cyfko.tgrep.core.parsing;
    exports io.github.cyfko.tgrep.core.tree;
    exports io.github.cyfko.tgrep.core.utils;
}
