package userinfo;

import static org.junit.jupiter.api.Assertions.*;

import io.micronaut.context.ApplicationContext;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import util.UserInfoExtractor;

@MicronautTest
class WiringSmokeTest {

  @Inject ApplicationContext ctx;

  @Test
  void beansArePresent() {
    assertTrue(ctx.containsBean(HelloController.class));
    assertTrue(ctx.containsBean(UserInfoExtractor.class));
    assertTrue(ctx.containsBean(UserInfoArgumentBinder.class));
    assertTrue(ctx.containsBean(UserInfoExceptionHandler.class));
  }

  @Test
  void defaultHeaderNameIsUserInfoHeader() {
    assertEquals(
        UserInfoConfiguration.DEFAULT_HEADER_NAME,
        ctx.getBean(UserInfoExtractor.class).getHeaderName());
  }
}
