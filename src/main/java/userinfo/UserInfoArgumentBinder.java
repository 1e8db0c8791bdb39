package userinfo;

import io.micronaut.core.convert.ArgumentConversionContext;
import io.micronaut.core.type.Argument;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.bind.binders.TypedRequestArgumentBinder;
import jakarta.inject.Singleton;
import java.util.Optional;
import util.UserInfoExtractor;

/**
 * Lets controller methods declare a {@link UserInfo} parameter. Extraction failures are thrown as
 * {@link UserInfoException} and stop the request before the handler runs.
 */
@Singleton
public class UserInfoArgumentBinder implements TypedRequestArgumentBinder<UserInfo> {

  private final UserInfoExtractor userInfoExtractor;

  public UserInfoArgumentBinder(UserInfoExtractor userInfoExtractor) {
    this.userInfoExtractor = userInfoExtractor;
  }

  @Override
  public Argument<UserInfo> argumentType() {
    return Argument.of(UserInfo.class);
  }

  @Override
  public BindingResult<UserInfo> bind(
      ArgumentConversionContext<UserInfo> context, HttpRequest<?> source) {
    UserInfo userInfo = userInfoExtractor.extract(source);
    return () -> Optional.of(userInfo);
  }
}
