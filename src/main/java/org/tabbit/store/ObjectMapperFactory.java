package org.tabbit.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

/**
 * The one JSON mapping used for tournament files, HTTP bodies and CLI output, so that a
 * {@code tournament.json} written by the server reads back identically in the CLI.
 *
 * <p>{@link org.tabbit.compute.History} exposes Guava {@code ImmutableSetMultimap}s, which
 * need the Guava module to be written as {@code {"key": [values]}} and read back.
 */
public final class ObjectMapperFactory {

    private ObjectMapperFactory() {}

    public static ObjectMapper create() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new GuavaModule());
        mapper.registerModule(new Jdk8Module());
        return mapper;
    }

    /**
     * Indented writer for files meant to be read and diffed by tab staff.
     */
    public static ObjectWriter prettyWriter(ObjectMapper mapper) {
        return mapper.writerWithDefaultPrettyPrinter();
    }
}
