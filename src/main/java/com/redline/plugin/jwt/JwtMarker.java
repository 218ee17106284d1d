package com.redline.plugin.jwt;

import com.redline.param.ParameterMarker;

/** Parameter markers contributed by the {@link JwtPlugin}. */
public enum JwtMarker implements ParameterMarker {
  /** The validated {@code io.jsonwebtoken.Claims} of the request's token. */
  CLAIMS
}
