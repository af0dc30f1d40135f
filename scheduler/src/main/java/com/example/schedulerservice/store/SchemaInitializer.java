package com.example.schedulerservice.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the tables listed in the schema descriptor. Statements are expected to
 * be idempotent ({@code CREATE TABLE IF NOT EXISTS}).
 */
@Slf4j
public class SchemaInitializer {
    public static final String DEFAULT_RESOURCE = "/db-tables.json";

    private final ObjectMapper mapper;

    public SchemaInitializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public SchemaDescriptor loadFromFile(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            return read(is, path.toString());
        } catch (IOException e) {
            throw new StoreException("failed to read schema descriptor " + path, e);
        }
    }

    public SchemaDescriptor loadFromClasspath(String resource) {
        try (InputStream is = SchemaInitializer.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new StoreException("schema descriptor " + resource + " not found on classpath");
            }
            return read(is, resource);
        } catch (IOException e) {
            throw new StoreException("failed to read schema descriptor " + resource, e);
        }
    }

    public void apply(DataSource ds, SchemaDescriptor descriptor) {
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            for (SchemaDescriptor.Table table : descriptor.getTables()) {
                try {
                    st.execute(table.getSql());
                } catch (SQLException e) {
                    throw new StoreException("failed to create table \"" + table.getName() + "\"", e);
                }
                log.info("Table {} ready", table.getName());
            }
        } catch (SQLException e) {
            throw new StoreException("failed to connect to database", e);
        }
    }

    private SchemaDescriptor read(InputStream is, String source) throws IOException {
        SchemaDescriptor descriptor = mapper.readValue(is, SchemaDescriptor.class);
        if (descriptor.getTables() == null || descriptor.getTables().isEmpty()) {
            throw new StoreException("schema descriptor " + source + " defines no tables");
        }
        for (SchemaDescriptor.Table t : descriptor.getTables()) {
            if (t.getName() == null || t.getSql() == null || t.getSql().isBlank()) {
                throw new StoreException("schema descriptor " + source + " has a table without name or sql");
            }
        }
        return descriptor;
    }
}
