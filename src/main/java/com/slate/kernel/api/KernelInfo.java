package com.slate.kernel.api;

import com.slate.kernel.ast.Node;

import java.util.List;

/**
 * Everything the form compiler reports about one generated subkernel.
 *
 * @param kernel             The generated function AST.
 * @param integralType       Integral type the subkernel integrates over.
 * @param subdomainId        Subdomain marker; {@link #DEFAULT_SUBDOMAIN} when
 *                           the integral covers the whole domain.
 * @param oriented           Whether the kernel needs cell orientations.
 * @param needsCellSizes     Whether the kernel needs cell sizes.
 * @param coefficientNumbers Positions, in the form's coefficient list, of the
 *                           coefficients the kernel actually uses.
 */
public record KernelInfo(Node kernel, IntegralType integralType, String subdomainId, boolean oriented,
        boolean needsCellSizes, List<Integer> coefficientNumbers) {

    public static final String DEFAULT_SUBDOMAIN = "otherwise";

    public KernelInfo {
        if (kernel == null)
            throw new IllegalArgumentException("KernelInfo needs a kernel AST");
        if (integralType == null)
            integralType = IntegralType.CELL;
        if (subdomainId == null)
            subdomainId = DEFAULT_SUBDOMAIN;
        coefficientNumbers = coefficientNumbers == null ? List.of() : List.copyOf(coefficientNumbers);
    }

    /** A cell kernel over the whole domain. */
    public static KernelInfo cell(Node kernel, boolean oriented) {
        return new KernelInfo(kernel, IntegralType.CELL, DEFAULT_SUBDOMAIN, oriented, false, List.of());
    }

    public boolean isDefaultSubdomain() {
        return DEFAULT_SUBDOMAIN.equals(subdomainId);
    }
}
