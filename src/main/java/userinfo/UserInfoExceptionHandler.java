package userinfo;

import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;

/** Every user-info failure is a 400 with the plain-text message, whatever its kind. */
@Produces(MediaType.TEXT_PLAIN)
@Singleton
public class UserInfoExceptionHandler
    implements ExceptionHandler<UserInfoException, HttpResponse<String>> {

  @Override
  public HttpResponse<String> handle(HttpRequest request, UserInfoException exception) {
    return HttpResponse.<String>badRequest(exception.getMessage())
        .contentType(MediaType.TEXT_PLAIN_TYPE);
  }
}
