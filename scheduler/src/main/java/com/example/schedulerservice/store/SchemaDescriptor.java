package com.example.schedulerservice.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Table definitions loaded from {@code db-tables.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SchemaDescriptor {
    private List<Table> tables = new ArrayList<>();

    public List<Table> getTables() {
        return tables;
    }

    public void setTables(List<Table> tables) {
        this.tables = tables;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Table {
        private String name;
        private String sql;

        public Table() {
        }

        public Table(String name, String sql) {
            this.name = name;
            this.sql = sql;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getSql() {
            return sql;
        }

        public void setSql(String sql) {
            this.sql = sql;
        }
    }
}
