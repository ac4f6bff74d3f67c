package kz.qazmarka.orch.topology;

import java.util.Objects;

/**
 * Описание топика для отправки: имя и строка подключения к пространству имён.
 */
public class TopicInfo {

    private final String name;
    private final String connectionInfo;

    public TopicInfo(String name, String connectionInfo) {
        this.name = Objects.requireNonNull(name, "name");
        this.connectionInfo = connectionInfo;
    }

    public String getName() {
        return name;
    }

    public String getConnectionInfo() {
        return connectionInfo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TopicInfo that = (TopicInfo) o;
        return name.equals(that.name) && Objects.equals(connectionInfo, that.connectionInfo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, connectionInfo);
    }

    @Override
    public String toString() {
        return "TopicInfo{name='" + name + "'}";
    }
}
