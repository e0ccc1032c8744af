package net.grammarc.util.config;

public interface Configuration {

    String get(String key);

}
