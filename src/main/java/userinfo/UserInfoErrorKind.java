package userinfo;

/** Why the user-info header could not be turned into a {@link UserInfo}, in check order. */
public enum UserInfoErrorKind {
  HEADER_MISSING("Not found"),
  INVALID_BASE64("Not a valid base 64"),
  INVALID_JSON("Not a valid JSON");

  private final String reason;

  UserInfoErrorKind(String reason) {
    this.reason = reason;
  }

  public String reason() {
    return reason;
  }

  public String message(String headerName) {
    return "Invalid " + headerName + " : " + reason;
  }
}
