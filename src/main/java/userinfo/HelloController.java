package userinfo;

import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Produces;
import java.util.Map;

@Controller("/")
public class HelloController {

  @Get
  @Produces(MediaType.APPLICATION_JSON)
  public Map<String, Object> hello(UserInfo userInfo) {
    return Map.of("message", "hello", "userInfo", userInfo.payload());
  }
}
