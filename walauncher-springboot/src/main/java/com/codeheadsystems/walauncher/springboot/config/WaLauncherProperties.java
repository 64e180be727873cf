package com.codeheadsystems.walauncher.springboot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "walauncher")
public class WaLauncherProperties {

  private String clientId = "";
  private String clientSecret = "";
  private String appUrl = "http://localhost:8080";
  private String scopes = "read_script_tags,write_script_tags";
  private String storeBackend = "file";
  private String dataDir = "./data";
  private long oauthStateTtlSeconds = 600;
  private long launchRequestMaxAgeSeconds = 86_400;
  private String adminApiVersion = "2023-10";
  private long outboundTimeoutMillis = 10_000;
  private String adminOrigin = "https://admin.shopify.com";
  private boolean devQueryParamAuth = false;

  public String getClientId() {
    return clientId;
  }

  public void setClientId(String clientId) {
    this.clientId = clientId;
  }

  public String getClientSecret() {
    return clientSecret;
  }

  public void setClientSecret(String clientSecret) {
    this.clientSecret = clientSecret;
  }

  public String getAppUrl() {
    return appUrl;
  }

  public void setAppUrl(String appUrl) {
    this.appUrl = appUrl;
  }

  public String getScopes() {
    return scopes;
  }

  public void setScopes(String scopes) {
    this.scopes = scopes;
  }

  public String getStoreBackend() {
    return storeBackend;
  }

  public void setStoreBackend(String storeBackend) {
    this.storeBackend = storeBackend;
  }

  public String getDataDir() {
    return dataDir;
  }

  public void setDataDir(String dataDir) {
    this.dataDir = dataDir;
  }

  public long getOauthStateTtlSeconds() {
    return oauthStateTtlSeconds;
  }

  public void setOauthStateTtlSeconds(long oauthStateTtlSeconds) {
    this.oauthStateTtlSeconds = oauthStateTtlSeconds;
  }

  public long getLaunchRequestMaxAgeSeconds() {
    return launchRequestMaxAgeSeconds;
  }

  public void setLaunchRequestMaxAgeSeconds(long launchRequestMaxAgeSeconds) {
    this.launchRequestMaxAgeSeconds = launchRequestMaxAgeSeconds;
  }

  public String getAdminApiVersion() {
    return adminApiVersion;
  }

  public void setAdminApiVersion(String adminApiVersion) {
    this.adminApiVersion = adminApiVersion;
  }

  public long getOutboundTimeoutMillis() {
    return outboundTimeoutMillis;
  }

  public void setOutboundTimeoutMillis(long outboundTimeoutMillis) {
    this.outboundTimeoutMillis = outboundTimeoutMillis;
  }

  public String getAdminOrigin() {
    return adminOrigin;
  }

  public void setAdminOrigin(String adminOrigin) {
    this.adminOrigin = adminOrigin;
  }

  public boolean isDevQueryParamAuth() {
    return devQueryParamAuth;
  }

  public void setDevQueryParamAuth(boolean devQueryParamAuth) {
    this.devQueryParamAuth = devQueryParamAuth;
  }
}
