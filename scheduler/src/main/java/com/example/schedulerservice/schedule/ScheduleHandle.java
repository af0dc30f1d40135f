package com.example.schedulerservice.schedule;

/**
 * Opaque reference to a recurring timer created by a {@link RecurrenceScheduler}.
 */
public final class ScheduleHandle {
    private final long id;
    private final String expression;

    public ScheduleHandle(long id, String expression) {
        this.id = id;
        this.expression = expression;
    }

    public long getId() {
        return id;
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ScheduleHandle && ((ScheduleHandle) o).id == id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "ScheduleHandle{id=" + id + ", expression=" + expression + "}";
    }
}
