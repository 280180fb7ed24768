package com.aiinpocket.parkfinder.security;

import com.aiinpocket.parkfinder.config.ParkFinderProperties;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.Collection;
import java.util.List;

/**
 * 把外部身分提供者的 JWT 轉成權限。
 * 所有有效 token 都是 ROLE_USER；設定的 claim 等於（或為陣列時包含）管理員值則加上 ROLE_ADMIN。
 */
public class AdminClaimAuthoritiesConverter implements Converter<Jwt, Collection<GrantedAuthority>> {

    private static final GrantedAuthority USER = new SimpleGrantedAuthority("ROLE_USER");
    private static final GrantedAuthority ADMIN = new SimpleGrantedAuthority(CallerArgumentResolver.ADMIN_AUTHORITY);

    private final String adminClaim;
    private final String adminValue;

    public AdminClaimAuthoritiesConverter(ParkFinderProperties.Identity identity) {
        this.adminClaim = identity.adminClaim();
        this.adminValue = identity.adminValue();
    }

    @Override
    public Collection<GrantedAuthority> convert(Jwt jwt) {
        return isAdmin(jwt) ? List.of(USER, ADMIN) : List.of(USER);
    }

    private boolean isAdmin(Jwt jwt) {
        Object claim = jwt.getClaim(adminClaim);
        if (claim instanceof Collection<?> values) {
            return values.stream().anyMatch(v -> adminValue.equals(String.valueOf(v)));
        }
        return claim != null && adminValue.equals(claim.toString());
    }
}
