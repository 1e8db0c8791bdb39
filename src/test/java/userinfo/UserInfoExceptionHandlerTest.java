package userinfo;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MediaType;
import org.junit.jupiter.api.Test;

class UserInfoExceptionHandlerTest {

  private final UserInfoExceptionHandler handler = new UserInfoExceptionHandler();

  @Test
  void handle_mapsEveryKindToBadRequestWithMessageBody() {
    for (UserInfoErrorKind kind : UserInfoErrorKind.values()) {
      HttpResponse<String> response =
          handler.handle(
              mock(HttpRequest.class), new UserInfoException(kind, "X-Endpoint-API-UserInfo"));

      assertEquals(HttpStatus.BAD_REQUEST, response.getStatus());
      assertEquals(
          "Invalid X-Endpoint-API-UserInfo : " + kind.reason(), response.body());
      assertEquals(
          MediaType.TEXT_PLAIN, response.getContentType().map(MediaType::getName).orElse(""));
    }
  }

  @Test
  void errorKinds_carryLiteralReasons() {
    assertEquals("Not found", UserInfoErrorKind.HEADER_MISSING.reason());
    assertEquals("Not a valid base 64", UserInfoErrorKind.INVALID_BASE64.reason());
    assertEquals("Not a valid JSON", UserInfoErrorKind.INVALID_JSON.reason());
  }
}
