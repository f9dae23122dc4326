package com.github.dimitryivaniuta.cmdb.resource.vpc;

import com.github.dimitryivaniuta.cmdb.resource.NetworkResourceRepository;

public interface VpcRepository extends NetworkResourceRepository<Vpc> {
}
