package com.glassbox.calc.expr;

import java.util.List;

import com.glassbox.calc.namespace.Ref;

/**
 * @param samePeriod references read at the period being computed (or across the whole horizon)
 * @param lagged     references read only at earlier periods
 */
public record FormulaDependencies(List<Ref> samePeriod, List<Ref> lagged) {
}
