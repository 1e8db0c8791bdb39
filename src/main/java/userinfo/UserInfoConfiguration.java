package userinfo;

import io.micronaut.context.annotation.ConfigurationProperties;

@ConfigurationProperties("user-info")
public class UserInfoConfiguration {

  public static final String DEFAULT_HEADER_NAME = "X-Endpoint-API-UserInfo";

  private String headerName = DEFAULT_HEADER_NAME;

  public String getHeaderName() {
    return headerName;
  }

  public void setHeaderName(String headerName) {
    this.headerName = headerName;
  }
}
