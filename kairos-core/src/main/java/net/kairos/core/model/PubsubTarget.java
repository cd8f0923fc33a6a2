package net.kairos.core.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

public record PubsubTarget(
        String topicName,   // projects/{project}/topics/{topic}
        byte[] data,
        Map<String, String> attributes
) implements JobTarget {
    public PubsubTarget {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        data = data == null ? new byte[0] : data.clone();
    }

    public static PubsubTarget of(String topicName) {
        return new PubsubTarget(topicName, null, Map.of());
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PubsubTarget that)) return false;
        return Objects.equals(topicName, that.topicName)
                && Arrays.equals(data, that.data)
                && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(topicName, attributes) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "PubsubTarget[topicName=" + topicName + ", data=" + data.length
                + " bytes, attributes=" + attributes + "]";
    }
}
