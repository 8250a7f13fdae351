package com.presales.outreach.config;

import io.jsonwebtoken.*;
import io.jsonwebtoken.security.Keys;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.*;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.*;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.OncePerRequestFilter;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.*;

import static org.springframework.security.config.Customizer.withDefaults;

/**
 * Operator endpoints under {@code /api} require a bearer JWT. The provider webhook is public and
 * authenticated by its shared secret instead.
 */
@Configuration
public class SecurityConfig {

  @Bean
  JwtService jwtService(@Value("${app.jwt-secret}") String secret) {
    return new JwtService(secret);
  }

  @Bean
  CorsConfigurationSource corsConfigurationSource(@Value("${app.cors.allowed-origins:http://localhost:5173}") List<String> origins) {
    CorsConfiguration config = new CorsConfiguration();
    config.setAllowedOrigins(origins);
    config.setAllowedMethods(List.of("GET", "POST", "DELETE", "OPTIONS"));
    config.setAllowedHeaders(List.of("*"));
    config.setExposedHeaders(List.of(HttpHeaders.AUTHORIZATION));
    config.setAllowCredentials(true);

    UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", config);
    return source;
  }

  @Bean SecurityFilterChain filterChain(HttpSecurity http, JwtService jwtService) throws Exception {
    return http.csrf(c->c.disable())
      .cors(withDefaults())
      .sessionManagement(s->s.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
      .authorizeHttpRequests(a->a
        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
        .requestMatchers("/webhook/**", "/actuator/health").permitAll()
        .requestMatchers("/api/orchestration/**").hasRole("OPERATOR_ADMIN")
        .anyRequest().authenticated())
      .addFilterBefore(new JwtFilter(jwtService), UsernamePasswordAuthenticationFilter.class)
      .build();
  }

  /** Verifies operator tokens; they are minted by the operator identity provider with the shared secret. */
  public static class JwtService {
    private final SecretKey key;
    public JwtService(String secret){ this.key=Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8)); }
    public Jws<Claims> parse(String token){ return Jwts.parser().verifyWith(key).build().parseSignedClaims(token); }
  }

  static class JwtFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(JwtFilter.class);
    private final JwtService jwt;
    JwtFilter(JwtService jwt){this.jwt=jwt;}
    @Override protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain) throws ServletException, IOException {
      String h=req.getHeader(HttpHeaders.AUTHORIZATION);
      if(h!=null && h.startsWith("Bearer ")){
        try {
          Claims c=jwt.parse(h.substring(7)).getPayload();
          var auth=new UsernamePasswordAuthenticationToken(c.getSubject(),null, List.of(new SimpleGrantedAuthority("ROLE_"+c.get("role",String.class))));
          SecurityContextHolder.getContext().setAuthentication(auth);
        } catch (JwtException | IllegalArgumentException ex) {
          log.debug("Rejected bearer token path={} reason={}", req.getRequestURI(), ex.getMessage());
        }
      }
      chain.doFilter(req,res);
    }
  }
}
