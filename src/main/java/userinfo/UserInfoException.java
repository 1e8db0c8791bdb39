package userinfo;

/**
 * Raised when the user-info header is missing or cannot be decoded. Always terminal for the
 * request: {@link UserInfoExceptionHandler} turns it into a 400 response carrying {@link
 * #getMessage()} verbatim.
 */
public class UserInfoException extends RuntimeException {

  private final UserInfoErrorKind kind;
  private final String headerName;

  public UserInfoException(UserInfoErrorKind kind, String headerName) {
    this(kind, headerName, null);
  }

  public UserInfoException(UserInfoErrorKind kind, String headerName, Throwable cause) {
    super(kind.message(headerName), cause);
    this.kind = kind;
    this.headerName = headerName;
  }

  public UserInfoErrorKind getKind() {
    return kind;
  }

  public String getHeaderName() {
    return headerName;
  }
}
