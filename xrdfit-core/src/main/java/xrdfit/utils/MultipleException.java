/*
 * Copyright (C) 2018 Jean Ollion
 *
 * This File is part of XRDFIT
 *
 * XRDFIT is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * XRDFIT is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with XRDFIT.  If not, see <http://www.gnu.org/licenses/>.
 */
package xrdfit.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.BiPredicate;

public class MultipleException extends RuntimeException {
    public final static Logger logger = LoggerFactory.getLogger(MultipleException.class);
    final private List<Pair<String, Throwable>> exceptions; // localized exception: string = source of the exception (file name, group...)
    public MultipleException(List<Pair<String, Throwable>> exceptions) {
        this.exceptions= new ArrayList<>();
        addExceptions(exceptions);
    }
    public MultipleException() {
        this.exceptions=new ArrayList<>();
    }
    public void addExceptions(Collection<Pair<String, Throwable>> ex) {
        ex.forEach(this::addException);
    }

    public void addException(Pair<String, Throwable> ex) {
        if (ex==null || ex.value==null || ex.key==null) return;
        boolean[] added = new boolean[1];
        exceptions.stream().filter(p->thowableEqual.test(p.value, ex.value)).findAny().ifPresent(p->{
            p.key+=";"+ex.key;
            added[0] = true;
        });
        if (!added[0]) exceptions.add(ex);
    }

    private final static BiPredicate<Throwable, Throwable> tEq = (t1, t2) -> {
       return  t1==null ? t2==null :
               (t2==null ? false :
               (t1.getMessage()==null ? t2.getMessage()==null :
               (t2.getMessage()==null ? false : t1.getMessage().equals(t2.getMessage())))
                    && Arrays.equals(t1.getStackTrace(), t2.getStackTrace()));
    };
    public final static BiPredicate<Throwable, Throwable> thowableEqual = (t1, t2) -> tEq.test(t1, t2) && tEq.test(t1.getCause(), t2.getCause());

    public List<Pair<String, Throwable>> getExceptions() {
        return exceptions;
    }
    public boolean isEmpty() {
        return exceptions.isEmpty();
    }

    @Override
    public String getMessage() {
        return exceptions.size()+" error(s): "+Utils.toStringList(exceptions, p -> p.key + ": " + p.value.getMessage());
    }
}
