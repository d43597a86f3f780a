package com.miniomcp.storage;

/**
 * Connection settings for one MinIO endpoint. Defaults: port 9000, SSL off, region us-east-1.
 */
public record ConnectionConfig(
        String endpoint,
        int port,
        boolean useSsl,
        String accessKey,
        String secretKey,
        String region
) {
    public static final int DEFAULT_PORT = 9000;
    public static final String DEFAULT_REGION = "us-east-1";

    public ConnectionConfig {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint is required");
        }
        if (accessKey == null || accessKey.isBlank()) {
            throw new IllegalArgumentException("accessKey is required");
        }
        if (secretKey == null || secretKey.isBlank()) {
            throw new IllegalArgumentException("secretKey is required");
        }
        endpoint = endpoint.trim();
        if (port <= 0) port = DEFAULT_PORT;
        if (region == null || region.isBlank()) region = DEFAULT_REGION;
    }

    public static ConnectionConfig of(String endpoint, Integer port, Boolean useSsl,
                                      String accessKey, String secretKey, String region) {
        return new ConnectionConfig(endpoint,
                port == null ? DEFAULT_PORT : port,
                Boolean.TRUE.equals(useSsl),
                accessKey, secretKey, region);
    }

    public static ConnectionConfig from(MinioProps props) {
        return new ConnectionConfig(props.getEndpoint(), props.getPort(), props.isSecure(),
                props.getAccessKey(), props.getSecretKey(), props.getRegion());
    }

    public String describeEndpoint() {
        return (useSsl ? "https://" : "http://") + endpoint + ":" + port;
    }

    @Override
    public String toString() {
        return "ConnectionConfig[endpoint=" + describeEndpoint()
                + ", accessKey=" + accessKey + ", secretKey=****, region=" + region + "]";
    }
}
