package com.tracescope.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Objects;

/**
 * Network endpoint that recorded an annotation.
 * The service name is the key every span index is built on, so it is
 * always stored lower-cased.
 */
public class Endpoint {
    
    @JsonProperty("ipv4")
    private final int ipv4;
    
    @JsonProperty("port")
    private final int port;
    
    @JsonProperty("service_name")
    private final String serviceName;
    
    /**
     * Full constructor
     */
    public Endpoint(int ipv4, int port, String serviceName) {
        this.ipv4 = ipv4;
        this.port = port;
        this.serviceName = serviceName != null ? serviceName.toLowerCase(Locale.ROOT) : "";
    }
    
    // Getters
    
    public int getIpv4() {
        return ipv4;
    }
    
    public int getPort() {
        return port;
    }
    
    public String getServiceName() {
        return serviceName;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Endpoint)) return false;
        Endpoint endpoint = (Endpoint) o;
        return ipv4 == endpoint.ipv4
            && port == endpoint.port
            && serviceName.equals(endpoint.serviceName);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(ipv4, port, serviceName);
    }
    
    @Override
    public String toString() {
        return "Endpoint{" +
            "ipv4=" + ipv4 +
            ", port=" + port +
            ", serviceName='" + serviceName + '\'' +
            '}';
    }
}
